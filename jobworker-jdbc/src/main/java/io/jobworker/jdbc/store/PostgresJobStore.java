package io.jobworker.jdbc.store;

import io.jobworker.jdbc.JdbcTemplate;
import io.jobworker.model.Job;
import io.jobworker.model.JobStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL job store.
 *
 * <p>Claims with {@code FOR UPDATE SKIP LOCKED} and {@code RETURNING} in a single round-trip;
 * concurrent claimers skip locked rows instead of waiting for them.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new PostgresJobStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public Optional<Job> claimNext(Connection conn, Set<String> excludedTypes, Instant now) {
    List<Object> params = new ArrayList<>();
    params.add(JdbcTemplate.timestamp(now));
    params.addAll(excludedTypes);
    String sql = "UPDATE " + tableName() +
        " SET status='" + JobStatus.PROCESSING.dbValue() + "', updated_at=?" +
        " WHERE job_id = (" +
        "SELECT job_id FROM " + tableName() +
        " WHERE status='" + JobStatus.PENDING.dbValue() + "'" + excludedTypesClause(excludedTypes) +
        " ORDER BY created_at, job_id LIMIT 1" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + JOB_COLUMNS;
    List<Job> claimed = JdbcTemplate.updateReturning(conn, sql, JOB_ROW_MAPPER, params.toArray());
    return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
  }
}
