package io.jobworker.jdbc.store;

import io.jobworker.jdbc.JdbcTemplate;
import io.jobworker.jdbc.TableNames;
import io.jobworker.model.Job;
import io.jobworker.model.JobStatus;
import io.jobworker.spi.JobStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>The default {@link #claimNext} selects a few candidate ids and claims the first one
 * whose compare-and-set {@code UPDATE ... WHERE status='pending'} succeeds, so a row lost
 * to a concurrent claimer is skipped. Subclasses override it with row-locking strategies.
 * Register custom implementations via
 * {@code META-INF/services/io.jobworker.jdbc.store.AbstractJdbcJobStore}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  private static final int CLAIM_CANDIDATES = 16;

  protected static final String JOB_COLUMNS =
      "job_id, job_type, payload, status, retries, created_at, updated_at";

  protected static final JdbcTemplate.RowMapper<Job> JOB_ROW_MAPPER = rs -> new Job(
      rs.getLong("job_id"),
      rs.getString("job_type"),
      rs.getString("payload"),
      JobStatus.fromDbValue(rs.getString("status")),
      rs.getInt("retries"),
      rs.getTimestamp("created_at").toInstant(),
      rs.getTimestamp("updated_at").toInstant());

  private final String tableName;

  protected AbstractJdbcJobStore() {
    this(TableNames.JOBS);
  }

  protected AbstractJdbcJobStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this job store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this job store handles (e.g., "jdbc:mysql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind operating on another table.
   */
  public abstract AbstractJdbcJobStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  @Override
  public Optional<Job> claimNext(Connection conn, Set<String> excludedTypes, Instant now) {
    List<Object> params = new ArrayList<>(excludedTypes);
    params.add(CLAIM_CANDIDATES);
    String selectSql = "SELECT job_id FROM " + tableName() +
        " WHERE status='" + JobStatus.PENDING.dbValue() + "'" + excludedTypesClause(excludedTypes) +
        " ORDER BY created_at, job_id LIMIT ?";
    List<Long> candidates = JdbcTemplate.query(conn, selectSql, rs -> rs.getLong(1), params.toArray());

    String claimSql = "UPDATE " + tableName() +
        " SET status='" + JobStatus.PROCESSING.dbValue() + "', updated_at=?" +
        " WHERE job_id=? AND status='" + JobStatus.PENDING.dbValue() + "'";
    for (Long jobId : candidates) {
      if (JdbcTemplate.update(conn, claimSql, JdbcTemplate.timestamp(now), jobId) == 1) {
        return findById(conn, jobId);
      }
    }
    return Optional.empty();
  }

  @Override
  public Optional<JobStatus> finish(Connection conn, long jobId, boolean success,
      int currentRetries, int retryCeiling, Instant now) {
    if (success) {
      String sql = "UPDATE " + tableName() +
          " SET status='" + JobStatus.COMPLETED.dbValue() + "', updated_at=?" +
          " WHERE job_id=? AND status='" + JobStatus.PROCESSING.dbValue() + "'";
      int updated = JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(now), jobId);
      return updated == 1 ? Optional.of(JobStatus.COMPLETED) : Optional.empty();
    }
    JobStatus next = currentRetries < retryCeiling ? JobStatus.PENDING : JobStatus.FAILED;
    String sql = "UPDATE " + tableName() + " SET status=?, retries=?, updated_at=?" +
        " WHERE job_id=? AND status='" + JobStatus.PROCESSING.dbValue() + "'";
    int updated = JdbcTemplate.update(conn, sql,
        next.dbValue(), currentRetries + 1, JdbcTemplate.timestamp(now), jobId);
    return updated == 1 ? Optional.of(next) : Optional.empty();
  }

  @Override
  public long enqueue(Connection conn, String jobType, String payloadJson, Instant now) {
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(payloadJson, "payloadJson");
    String sql = "INSERT INTO " + tableName() +
        " (job_type, payload, status, retries, created_at, updated_at) VALUES (?,?,?,0,?,?)";
    return JdbcTemplate.insertReturningKey(conn, sql, jobType, payloadJson,
        JobStatus.PENDING.dbValue(), JdbcTemplate.timestamp(now), JdbcTemplate.timestamp(now));
  }

  @Override
  public Optional<Job> findById(Connection conn, long jobId) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + tableName() + " WHERE job_id=?";
    return JdbcTemplate.queryOne(conn, sql, JOB_ROW_MAPPER, jobId);
  }

  @Override
  public int requeueStale(Connection conn, Instant staleBefore, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status='" + JobStatus.PENDING.dbValue() + "', retries=retries+1, updated_at=?" +
        " WHERE status='" + JobStatus.PROCESSING.dbValue() + "' AND updated_at < ?";
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(now), JdbcTemplate.timestamp(staleBefore));
  }

  @Override
  public long countByStatus(Connection conn, JobStatus status) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE status=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong(1), status.dbValue()).orElse(0L);
  }

  /**
   * Returns {@code " AND job_type NOT IN (?,...)"} or an empty string. The excluded types
   * must be bound, in iteration order, before any later parameter.
   */
  protected static String excludedTypesClause(Set<String> excludedTypes) {
    if (excludedTypes.isEmpty()) {
      return "";
    }
    return " AND job_type NOT IN (" + String.join(",", Collections.nCopies(excludedTypes.size(), "?")) + ")";
  }
}
