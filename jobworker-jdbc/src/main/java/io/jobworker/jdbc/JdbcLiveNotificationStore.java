package io.jobworker.jdbc;

import io.jobworker.notify.LiveNotificationRecord;
import io.jobworker.spi.LiveNotificationStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link LiveNotificationStore} over the {@code live_notification_messages} table.
 */
public final class JdbcLiveNotificationStore implements LiveNotificationStore {
  private static final JdbcTemplate.RowMapper<LiveNotificationRecord> RECORD_ROW_MAPPER =
      rs -> new LiveNotificationRecord(
          rs.getString("entity_key"),
          rs.getString("target_id"),
          rs.getString("message_id"),
          rs.getTimestamp("created_at").toInstant());

  private final String tableName;

  public JdbcLiveNotificationStore() {
    this(TableNames.LIVE_NOTIFICATIONS);
  }

  public JdbcLiveNotificationStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public List<LiveNotificationRecord> findByEntity(Connection conn, String entityKey) {
    Objects.requireNonNull(entityKey, "entityKey");
    return JdbcTemplate.query(conn,
        "SELECT entity_key, target_id, message_id, created_at FROM " + tableName +
            " WHERE entity_key=? ORDER BY target_id",
        RECORD_ROW_MAPPER, entityKey);
  }

  @Override
  public void save(Connection conn, LiveNotificationRecord record) {
    Objects.requireNonNull(record, "record");
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET message_id=?, created_at=? WHERE entity_key=? AND target_id=?",
        record.messageId(), JdbcTemplate.timestamp(record.createdAt()), record.entityKey(), record.targetId());
    if (updated == 0) {
      JdbcTemplate.update(conn,
          "INSERT INTO " + tableName + " (entity_key, target_id, message_id, created_at) VALUES (?,?,?,?)",
          record.entityKey(), record.targetId(), record.messageId(), JdbcTemplate.timestamp(record.createdAt()));
    }
  }

  @Override
  public int delete(Connection conn, String entityKey, String targetId) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tableName + " WHERE entity_key=? AND target_id=?", entityKey, targetId);
  }

  @Override
  public int deleteOlderThan(Connection conn, Instant cutoff) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tableName + " WHERE created_at < ?", JdbcTemplate.timestamp(cutoff));
  }
}
