package io.jobworker.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Read-only record representing a row of the job table, as returned by
 * {@link io.jobworker.spi.JobStore#claimNext}.
 *
 * @param jobId       identity assigned at enqueue time
 * @param jobType     type tag selecting the dispatch path
 * @param payloadJson JSON payload, schema determined by {@code jobType}
 * @param status      status at the time the row was read
 * @param retries     number of failed attempts so far
 * @param createdAt   enqueue time, never changes
 * @param updatedAt   time of the last status transition
 */
public record Job(
    long jobId,
    String jobType,
    String payloadJson,
    JobStatus status,
    int retries,
    Instant createdAt,
    Instant updatedAt
) {

  public Optional<JobType> knownType() {
    return JobType.fromValue(jobType);
  }
}
