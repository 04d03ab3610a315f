package io.jobworker.jdbc;

import io.jobworker.spi.SettingsStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SettingsStore} over the {@code worker_settings} table. Portable SQL only: an
 * upsert is an {@code UPDATE} followed by an {@code INSERT} when no row matched.
 */
public final class JdbcSettingsStore implements SettingsStore {
  private final String tableName;

  public JdbcSettingsStore() {
    this(TableNames.SETTINGS);
  }

  public JdbcSettingsStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public Optional<String> get(Connection conn, String key) {
    Objects.requireNonNull(key, "key");
    return JdbcTemplate.queryOne(conn,
        "SELECT setting_value FROM " + tableName + " WHERE setting_key=?",
        rs -> rs.getString(1), key);
  }

  @Override
  public void put(Connection conn, String key, String value, Instant now) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET setting_value=?, updated_at=? WHERE setting_key=?",
        value, JdbcTemplate.timestamp(now), key);
    if (updated == 0) {
      JdbcTemplate.update(conn,
          "INSERT INTO " + tableName + " (setting_key, setting_value, updated_at) VALUES (?,?,?)",
          key, value, JdbcTemplate.timestamp(now));
    }
  }

  @Override
  public boolean compareAndSet(Connection conn, String key, String expected, String value, Instant now) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    if (expected != null) {
      return JdbcTemplate.update(conn,
          "UPDATE " + tableName + " SET setting_value=?, updated_at=? WHERE setting_key=? AND setting_value=?",
          value, JdbcTemplate.timestamp(now), key, expected) == 1;
    }
    try {
      JdbcTemplate.update(conn,
          "INSERT INTO " + tableName + " (setting_key, setting_value, updated_at) VALUES (?,?,?)",
          key, value, JdbcTemplate.timestamp(now));
      return true;
    } catch (JobStoreException e) {
      if (isDuplicateKey(e.getCause())) {
        return false;
      }
      throw e;
    }
  }

  // SQLState class 23: integrity constraint violation
  private static boolean isDuplicateKey(Throwable cause) {
    return cause instanceof SQLException
        && ((SQLException) cause).getSQLState() != null
        && ((SQLException) cause).getSQLState().startsWith("23");
  }
}
