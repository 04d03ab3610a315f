package io.jobworker.spi;

/**
 * Observability hook for exporting worker counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of jobs claimed by this worker.
   */
  void incrementClaimed();

  /**
   * Increments the count of jobs finished as {@code completed} after a successful handler run.
   */
  void incrementCompleted();

  /**
   * Increments the count of failed attempts that were put back to {@code pending}.
   */
  void incrementRequeued();

  /**
   * Increments the count of jobs moved to the terminal {@code failed} status.
   */
  void incrementFailed();

  /**
   * Increments the count of jobs dropped without running a handler.
   */
  default void incrementDropped() {
  }

  /**
   * Increments the count of actions rejected by the rate limiter.
   */
  default void incrementRateLimited() {
  }

  /**
   * Increments the count of jobs that exceeded the slow-job threshold.
   */
  default void incrementSlowJob() {
  }

  /**
   * Increments the count of broadcast jobs enqueued by the auto-broadcast trigger.
   */
  default void incrementAutoBroadcastTriggered() {
  }

  /**
   * Records the number of stale {@code processing} jobs returned to the queue.
   */
  default void recordLeaseRequeued(int count) {
  }

  /**
   * Records the wall-clock time spent dispatching a single job.
   *
   * @param durationMs dispatch time in milliseconds (always non-negative)
   */
  void recordJobDurationMs(long durationMs);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementClaimed() {
    }

    @Override
    public void incrementCompleted() {
    }

    @Override
    public void incrementRequeued() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void recordJobDurationMs(long durationMs) {
    }
  }
}
