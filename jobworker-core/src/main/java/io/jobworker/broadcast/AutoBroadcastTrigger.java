package io.jobworker.broadcast;

import io.jobworker.model.JobType;
import io.jobworker.spi.ConnectionProvider;
import io.jobworker.spi.JobStore;
import io.jobworker.spi.MetricsExporter;
import io.jobworker.spi.SettingsStore;
import io.jobworker.util.PayloadCodec;
import io.jobworker.worker.PeriodicTask;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Enqueues a {@code broadcast_message} job when the live metric reaches a threshold, at
 * most once per cooldown.
 *
 * <p>The time of the last trigger is kept in the settings table under
 * {@value #LAST_TRIGGERED_KEY} as an ISO-8601 instant, so the cooldown survives restarts and
 * is shared by every worker on the same database. The job insert and the marker update
 * commit in one transaction, and the marker is written with a compare-and-set against the
 * value read in that transaction: when several workers pass the check at once, only one
 * commits and the others roll back their job.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class AutoBroadcastTrigger implements PeriodicTask {
  private static final Logger logger = Logger.getLogger(AutoBroadcastTrigger.class.getName());

  public static final String LAST_TRIGGERED_KEY = "auto_broadcast.last_triggered_at";

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final SettingsStore settingsStore;
  private final LiveMetric liveMetric;
  private final BroadcastMessageFactory messageFactory;
  private final long threshold;
  private final Duration cooldown;
  private final PayloadCodec codec;
  private final MetricsExporter metrics;

  private AutoBroadcastTrigger(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.settingsStore = Objects.requireNonNull(builder.settingsStore, "settingsStore");
    this.liveMetric = Objects.requireNonNull(builder.liveMetric, "liveMetric");
    this.messageFactory = Objects.requireNonNull(builder.messageFactory, "messageFactory");
    this.cooldown = Objects.requireNonNull(builder.cooldown, "cooldown");
    if (builder.threshold < 1) {
      throw new IllegalArgumentException("threshold must be >= 1");
    }
    if (cooldown.isNegative()) {
      throw new IllegalArgumentException("cooldown must be >= 0");
    }
    this.threshold = builder.threshold;
    this.codec = builder.codec != null ? builder.codec : PayloadCodec.getDefault();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String name() {
    return "auto-broadcast";
  }

  @Override
  public void run(Instant now) throws Exception {
    checkAndTrigger(now);
  }

  /**
   * Checks the cooldown and the metric and enqueues a broadcast job when both allow it.
   *
   * @return {@code true} if a job was enqueued
   * @throws Exception if the metric or the database cannot be read
   */
  public boolean checkAndTrigger(Instant now) throws Exception {
    Objects.requireNonNull(now, "now");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (inCooldown(settingsStore.get(conn, LAST_TRIGGERED_KEY), now)) {
        return false;
      }
    }

    long value = liveMetric.currentValue();
    if (value < threshold) {
      logger.log(Level.FINE, "Live metric {0} below auto-broadcast threshold {1}", new Object[]{value, threshold});
      return false;
    }

    String payloadJson = codec.encode(messageFactory.payload(value, now));
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        // another worker may have triggered since the first read
        Optional<String> marker = settingsStore.get(conn, LAST_TRIGGERED_KEY);
        if (inCooldown(marker, now)) {
          conn.rollback();
          return false;
        }
        long jobId = jobStore.enqueue(conn, JobType.BROADCAST_MESSAGE.value(), payloadJson, now);
        if (!settingsStore.compareAndSet(conn, LAST_TRIGGERED_KEY, marker.orElse(null), now.toString(), now)) {
          conn.rollback();
          logger.log(Level.FINE, "Auto-broadcast already triggered by another worker");
          return false;
        }
        conn.commit();
        metrics.incrementAutoBroadcastTriggered();
        logger.log(Level.INFO, "Auto-broadcast triggered: metric={0}, jobId={1}", new Object[]{value, jobId});
        return true;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    }
  }

  private boolean inCooldown(Optional<String> marker, Instant now) {
    Optional<Instant> last = lastTriggered(marker);
    return last.isPresent() && Duration.between(last.get(), now).compareTo(cooldown) < 0;
  }

  private static Optional<Instant> lastTriggered(Optional<String> raw) {
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(raw.get()));
    } catch (DateTimeParseException e) {
      logger.log(Level.WARNING, "Ignoring unparseable " + LAST_TRIGGERED_KEY + " value: " + raw.get(), e);
      return Optional.empty();
    }
  }

  /** Builder for {@link AutoBroadcastTrigger}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private SettingsStore settingsStore;
    private LiveMetric liveMetric;
    private BroadcastMessageFactory messageFactory;
    private long threshold = 10;
    private Duration cooldown = Duration.ofHours(24);
    private PayloadCodec codec;
    private MetricsExporter metrics;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    public Builder settingsStore(SettingsStore settingsStore) {
      this.settingsStore = settingsStore;
      return this;
    }

    public Builder liveMetric(LiveMetric liveMetric) {
      this.liveMetric = liveMetric;
      return this;
    }

    public Builder messageFactory(BroadcastMessageFactory messageFactory) {
      this.messageFactory = messageFactory;
      return this;
    }

    /**
     * Minimum metric value that triggers a broadcast.
     *
     * <p>Optional. Defaults to {@code 10}.
     */
    public Builder threshold(long threshold) {
      this.threshold = threshold;
      return this;
    }

    /**
     * Minimum time between two automatic broadcasts.
     *
     * <p>Optional. Defaults to 24 hours.
     */
    public Builder cooldown(Duration cooldown) {
      this.cooldown = cooldown;
      return this;
    }

    public Builder codec(PayloadCodec codec) {
      this.codec = codec;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public AutoBroadcastTrigger build() {
      return new AutoBroadcastTrigger(this);
    }
  }
}
