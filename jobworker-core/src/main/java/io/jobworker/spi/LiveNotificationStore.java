package io.jobworker.spi;

import io.jobworker.notify.LiveNotificationRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Persistence for the last live alert sent per (tracked entity, delivery target).
 *
 * @see io.jobworker.notify.LiveNotificationDeduplicator
 */
public interface LiveNotificationStore {

  List<LiveNotificationRecord> findByEntity(Connection conn, String entityKey);

  /**
   * Stores a record, replacing any existing one for the same entity and target.
   */
  void save(Connection conn, LiveNotificationRecord record);

  int delete(Connection conn, String entityKey, String targetId);

  /**
   * Removes records created before {@code cutoff}.
   *
   * @return number of rows removed
   */
  int deleteOlderThan(Connection conn, Instant cutoff);
}
