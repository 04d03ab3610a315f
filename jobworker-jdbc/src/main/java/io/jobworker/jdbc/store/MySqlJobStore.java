package io.jobworker.jdbc.store;

import io.jobworker.jdbc.JdbcTemplate;
import io.jobworker.model.Job;
import io.jobworker.model.JobStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * MySQL 8 job store.
 *
 * <p>Locks the oldest pending row with {@code SELECT ... FOR UPDATE SKIP LOCKED}, then
 * updates it in the same transaction. The caller must have auto-commit disabled.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new MySqlJobStore(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public Optional<Job> claimNext(Connection conn, Set<String> excludedTypes, Instant now) {
    String lockSql = "SELECT job_id FROM " + tableName() +
        " WHERE status='" + JobStatus.PENDING.dbValue() + "'" + excludedTypesClause(excludedTypes) +
        " ORDER BY created_at, job_id LIMIT 1 FOR UPDATE SKIP LOCKED";
    Optional<Long> locked = JdbcTemplate.queryOne(conn, lockSql, rs -> rs.getLong(1), excludedTypes.toArray());
    if (locked.isEmpty()) {
      return Optional.empty();
    }
    String claimSql = "UPDATE " + tableName() +
        " SET status='" + JobStatus.PROCESSING.dbValue() + "', updated_at=? WHERE job_id=?";
    JdbcTemplate.update(conn, claimSql, JdbcTemplate.timestamp(now), locked.get());
    return findById(conn, locked.get());
  }
}
