package io.jobworker.spi;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Small persistent key-value table for worker bookkeeping such as cooldown markers.
 */
public interface SettingsStore {

  Optional<String> get(Connection conn, String key);

  /**
   * Inserts or overwrites the value for {@code key}.
   */
  void put(Connection conn, String key, String value, Instant now);

  /**
   * Writes {@code value} only if the stored value still equals {@code expected}.
   *
   * <p>A {@code null} {@code expected} means the key must be absent; the insert then relies on
   * the primary key so that only one concurrent writer succeeds. On PostgreSQL a rejected
   * insert aborts the transaction, so callers roll back when this returns {@code false}.
   *
   * @return {@code true} if this call wrote the value
   */
  boolean compareAndSet(Connection conn, String key, String expected, String value, Instant now);
}
