package io.jobworker.spi;

import io.jobworker.model.Job;
import io.jobworker.model.JobStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence boundary for the job table.
 *
 * <p>Every method runs on the caller's connection; the caller decides transaction
 * boundaries. {@link #claimNext} must run inside a transaction (auto-commit off) that
 * the caller commits immediately afterwards.
 *
 * @see io.jobworker.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

  /**
   * Claims the oldest pending job whose type is not excluded.
   *
   * <p>Selects the oldest {@code pending} row (by {@code created_at}, then
   * {@code job_id}), locks it so concurrent claimers skip it instead of waiting, sets its
   * status to {@code processing} and bumps {@code updated_at}. Under any number of
   * concurrent callers each pending row is returned to at most one of them.
   *
   * @param conn          connection with an open transaction
   * @param excludedTypes job types never returned by this call
   * @param now           timestamp written to {@code updated_at}
   * @return the claimed job (with status {@code PROCESSING}), or empty if none eligible
   */
  Optional<Job> claimNext(Connection conn, Set<String> excludedTypes, Instant now);

  /**
   * Records the outcome of a processing attempt.
   *
   * <p>On success the job becomes {@code completed}. On failure {@code retries} becomes
   * {@code currentRetries + 1} and the job returns to {@code pending} while
   * {@code currentRetries < retryCeiling}; otherwise it becomes {@code failed}.
   * {@code updated_at} is always refreshed. Rows not in {@code processing} are left
   * untouched.
   *
   * @return the status written, or empty if the row was not in {@code processing}
   */
  Optional<JobStatus> finish(Connection conn, long jobId, boolean success,
      int currentRetries, int retryCeiling, Instant now);

  /**
   * Inserts a new {@code pending} job with zero retries.
   *
   * @return the generated job id
   */
  long enqueue(Connection conn, String jobType, String payloadJson, Instant now);

  Optional<Job> findById(Connection conn, long jobId);

  /**
   * Returns {@code processing} jobs last updated before {@code staleBefore} to
   * {@code pending}, counting the abandoned attempt as a failed one.
   *
   * @return number of rows requeued
   */
  int requeueStale(Connection conn, Instant staleBefore, Instant now);

  long countByStatus(Connection conn, JobStatus status);
}
