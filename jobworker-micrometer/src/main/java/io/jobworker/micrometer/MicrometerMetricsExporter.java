package io.jobworker.micrometer;

import io.jobworker.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code jobworker.jobs.claimed}: jobs claimed by this worker</li>
 *   <li>{@code jobworker.jobs.completed}: jobs finished as completed</li>
 *   <li>{@code jobworker.jobs.requeued}: failed attempts put back to pending</li>
 *   <li>{@code jobworker.jobs.failed}: jobs that exhausted their retries</li>
 *   <li>{@code jobworker.jobs.dropped}: jobs completed without running a handler</li>
 *   <li>{@code jobworker.jobs.slow}: jobs above the slow-job threshold</li>
 *   <li>{@code jobworker.ratelimit.rejected}: actions denied by the rate limiter</li>
 *   <li>{@code jobworker.autobroadcast.triggered}: broadcasts enqueued automatically</li>
 *   <li>{@code jobworker.lease.requeued}: stale processing jobs returned to pending</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code jobworker.job.duration.ms}: dispatch time per job</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter claimed;
  private final Counter completed;
  private final Counter requeued;
  private final Counter failed;
  private final Counter dropped;
  private final Counter slow;
  private final Counter rateLimited;
  private final Counter autoBroadcasts;
  private final Counter leaseRequeued;
  private final DistributionSummary jobDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "jobworker"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "jobworker");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several workers in one
   * registry.
   *
   * @param namePrefix prefix for all meter names (e.g. {@code "bot.jobworker"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.claimed = counter(namePrefix + ".jobs.claimed", "Jobs claimed");
    this.completed = counter(namePrefix + ".jobs.completed", "Jobs finished as completed");
    this.requeued = counter(namePrefix + ".jobs.requeued", "Failed attempts requeued for retry");
    this.failed = counter(namePrefix + ".jobs.failed", "Jobs moved to failed after the retry ceiling");
    this.dropped = counter(namePrefix + ".jobs.dropped", "Jobs completed without running a handler");
    this.slow = counter(namePrefix + ".jobs.slow", "Jobs above the slow-job threshold");
    this.rateLimited = counter(namePrefix + ".ratelimit.rejected", "Actions rejected by the rate limiter");
    this.autoBroadcasts = counter(namePrefix + ".autobroadcast.triggered", "Broadcasts enqueued automatically");
    this.leaseRequeued = counter(namePrefix + ".lease.requeued", "Stale processing jobs returned to pending");
    this.jobDuration = DistributionSummary.builder(namePrefix + ".job.duration.ms")
        .description("Dispatch time per job in milliseconds")
        .baseUnit("milliseconds")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementClaimed() {
    if (closed) return;
    claimed.increment();
  }

  @Override
  public void incrementCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementRequeued() {
    if (closed) return;
    requeued.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementRateLimited() {
    if (closed) return;
    rateLimited.increment();
  }

  @Override
  public void incrementSlowJob() {
    if (closed) return;
    slow.increment();
  }

  @Override
  public void incrementAutoBroadcastTriggered() {
    if (closed) return;
    autoBroadcasts.increment();
  }

  @Override
  public void recordLeaseRequeued(int count) {
    if (closed || count <= 0) return;
    leaseRequeued.increment(count);
  }

  @Override
  public void recordJobDurationMs(long durationMs) {
    if (closed) return;
    jobDuration.record(Math.max(0L, durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(claimed, completed, requeued, failed, dropped, slow,
        rateLimited, autoBroadcasts, leaseRequeued, jobDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
