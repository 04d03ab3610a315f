package io.jobworker.worker;

import io.jobworker.DispatchResult;
import io.jobworker.dispatch.JobDispatcher;
import io.jobworker.model.Job;
import io.jobworker.model.JobStatus;
import io.jobworker.model.JobType;
import io.jobworker.spi.ConnectionProvider;
import io.jobworker.spi.JobStore;
import io.jobworker.spi.MetricsExporter;
import io.jobworker.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sequential job-queue worker: claims one job at a time, dispatches it and records the
 * outcome.
 *
 * <p>Each {@link #runCycle() cycle}:
 * <ol>
 *   <li>runs the periodic tasks (auto-broadcast, stale-processing lease, ...) when the
 *       periodic check interval has elapsed;
 *   <li>claims the oldest pending job whose type is not excluded, in its own short
 *       transaction;
 *   <li>dispatches it, then finishes it as {@code completed}, {@code pending} (retry) or
 *       {@code failed}, warning when the dispatch took longer than the slow-job threshold.
 * </ol>
 *
 * <p>{@link #run()} repeats cycles on the calling thread: without pause after a processed
 * job, after the poll interval when idle and after twice the poll interval when a cycle
 * failed. In run-once mode it returns after one processed job or after
 * {@code runOnceAttempts} empty polls. {@link #start()} runs the same loop on a daemon
 * thread.
 *
 * <p>Several workers, in one process or many, may share a table; each pending job is
 * claimed by at most one of them.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see JobWorker.Builder
 */
public final class JobWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobWorker.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final JobDispatcher dispatcher;
  private final Clock clock;
  private final Duration pollInterval;
  private final Duration periodicCheckInterval;
  private final Duration slowJobThreshold;
  private final Set<String> excludedTypes;
  private final int retryCeiling;
  private final boolean runOnce;
  private final int runOnceAttempts;
  private final Duration runOnceRetryDelay;
  private final Duration staleProcessingTimeout;
  private final List<PeriodicTask> periodicTasks;
  private final MetricsExporter metrics;

  private final Object pauseLock = new Object();
  private Instant lastPeriodicCheck;
  private Thread thread;
  private volatile boolean closed;

  private JobWorker(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.pollInterval = requirePositive(builder.pollInterval, "pollInterval");
    this.periodicCheckInterval = requirePositive(builder.periodicCheckInterval, "periodicCheckInterval");
    this.slowJobThreshold = requirePositive(builder.slowJobThreshold, "slowJobThreshold");
    this.runOnceRetryDelay = Objects.requireNonNull(builder.runOnceRetryDelay, "runOnceRetryDelay");
    this.excludedTypes = Set.copyOf(builder.excludedTypes);
    if (builder.retryCeiling < 0) {
      throw new IllegalArgumentException("retryCeiling must be >= 0");
    }
    if (builder.runOnceAttempts < 1) {
      throw new IllegalArgumentException("runOnceAttempts must be >= 1");
    }
    if (runOnceRetryDelay.isNegative()) {
      throw new IllegalArgumentException("runOnceRetryDelay must be >= 0");
    }
    this.retryCeiling = builder.retryCeiling;
    this.runOnce = builder.runOnce;
    this.runOnceAttempts = builder.runOnceAttempts;
    this.staleProcessingTimeout = builder.staleProcessingTimeout == null
        ? null : requirePositive(builder.staleProcessingTimeout, "staleProcessingTimeout");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    List<PeriodicTask> tasks = new ArrayList<>(builder.periodicTasks);
    if (staleProcessingTimeout != null) {
      tasks.add(new StaleProcessingSweep());
    }
    this.periodicTasks = List.copyOf(tasks);
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the worker loop on a daemon thread.
   *
   * @throws IllegalStateException if already started or closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JobWorker has been closed");
    }
    if (thread != null) {
      throw new IllegalStateException("JobWorker already started");
    }
    thread = new DaemonThreadFactory("jobworker-").newThread(this::run);
    thread.start();
  }

  /**
   * Runs the worker loop on the calling thread until {@link #close()} is called or, in
   * run-once mode, until one job was processed or the empty-poll attempts ran out.
   */
  public void run() {
    logger.log(Level.INFO, "Job worker started (runOnce={0}, pollInterval={1}, excluded={2})",
        new Object[]{runOnce, pollInterval, excludedTypes});
    int emptyAttempts = 0;
    while (!closed) {
      CycleResult result = runCycle();
      if (runOnce) {
        if (result == CycleResult.PROCESSED) {
          break;
        }
        emptyAttempts++;
        if (emptyAttempts >= runOnceAttempts) {
          logger.log(Level.INFO, "No jobs found after {0} attempts", emptyAttempts);
          break;
        }
        if (!pause(result == CycleResult.ERROR ? pollInterval.multipliedBy(2) : runOnceRetryDelay)) {
          break;
        }
        continue;
      }
      if (result == CycleResult.IDLE && !pause(pollInterval)) {
        break;
      }
      if (result == CycleResult.ERROR && !pause(pollInterval.multipliedBy(2))) {
        break;
      }
    }
    logger.info("Job worker stopped");
  }

  /**
   * Executes one cycle. Never throws; failures are logged and reported as
   * {@link CycleResult#ERROR}.
   */
  public CycleResult runCycle() {
    try {
      Instant now = clock.instant();
      runPeriodicTasksIfDue(now);

      Optional<Job> claimed = claim(now);
      if (claimed.isEmpty()) {
        return CycleResult.IDLE;
      }
      return process(claimed.get());
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Worker cycle failed", t);
      return CycleResult.ERROR;
    }
  }

  private void runPeriodicTasksIfDue(Instant now) {
    if (periodicTasks.isEmpty()) {
      return;
    }
    if (lastPeriodicCheck != null && Duration.between(lastPeriodicCheck, now).compareTo(periodicCheckInterval) <= 0) {
      return;
    }
    lastPeriodicCheck = now;
    for (PeriodicTask task : periodicTasks) {
      try {
        task.run(now);
      } catch (Exception e) {
        logger.log(Level.SEVERE, "Periodic task " + task.name() + " failed", e);
      }
    }
  }

  private Optional<Job> claim(Instant now) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        Optional<Job> claimed = jobStore.claimNext(conn, excludedTypes, now);
        conn.commit();
        return claimed;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    }
  }

  private CycleResult process(Job job) throws SQLException {
    metrics.incrementClaimed();
    logger.log(Level.INFO, "Processing job {0} of type {1} (retries={2})",
        new Object[]{job.jobId(), job.jobType(), job.retries()});

    long startNanos = System.nanoTime();
    DispatchResult result;
    try {
      result = dispatcher.dispatch(job);
    } catch (Throwable t) {
      // errors from handler code still settle the job so it is not left in processing
      logger.log(Level.SEVERE, "Dispatcher failed for job " + job.jobId(), t);
      result = DispatchResult.retryable("Dispatcher failed: " + t, t);
    }
    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    metrics.recordJobDurationMs(durationMs);
    if (durationMs > slowJobThreshold.toMillis()) {
      metrics.incrementSlowJob();
      logger.log(Level.WARNING, "Slow job {0} of type {1}: {2} ms",
          new Object[]{job.jobId(), job.jobType(), durationMs});
    }
    if (result instanceof DispatchResult.Dropped) {
      metrics.incrementDropped();
      logger.log(Level.WARNING, "Job {0} dropped: {1}",
          new Object[]{job.jobId(), ((DispatchResult.Dropped) result).reason()});
    }

    Optional<JobStatus> status;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      status = jobStore.finish(conn, job.jobId(), result.isSuccess(), job.retries(), retryCeiling, clock.instant());
    }
    if (status.isEmpty()) {
      logger.log(Level.WARNING, "Job {0} was no longer processing; outcome not recorded", job.jobId());
      return CycleResult.PROCESSED;
    }
    recordOutcome(job, result, status.get());
    return CycleResult.PROCESSED;
  }

  private void recordOutcome(Job job, DispatchResult result, JobStatus status) {
    switch (status) {
      case COMPLETED:
        metrics.incrementCompleted();
        logger.log(Level.INFO, "Job {0} completed", job.jobId());
        break;
      case PENDING:
        metrics.incrementRequeued();
        logger.log(Level.WARNING, "Job " + job.jobId() + " failed, will retry (retries="
            + (job.retries() + 1) + "): " + reasonOf(result), causeOf(result));
        break;
      case FAILED:
        metrics.incrementFailed();
        logger.log(Level.SEVERE, "Job " + job.jobId() + " failed permanently after "
            + (job.retries() + 1) + " attempts: " + reasonOf(result), causeOf(result));
        break;
      default:
        logger.log(Level.WARNING, "Unexpected status {0} for job {1}", new Object[]{status, job.jobId()});
    }
  }

  private static String reasonOf(DispatchResult result) {
    return result instanceof DispatchResult.Retryable ? ((DispatchResult.Retryable) result).reason() : "";
  }

  private static Throwable causeOf(DispatchResult result) {
    return result instanceof DispatchResult.Retryable ? ((DispatchResult.Retryable) result).cause() : null;
  }

  // Returns false when the worker was closed or interrupted while waiting.
  private boolean pause(Duration duration) {
    long deadline = System.nanoTime() + duration.toNanos();
    synchronized (pauseLock) {
      while (!closed) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMs <= 0) {
          return true;
        }
        try {
          pauseLock.wait(remainingMs);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return false;
        }
      }
    }
    return false;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Stops the loop after the current cycle and waits up to 5 seconds for the worker
   * thread to exit.
   */
  @Override
  public void close() {
    Thread running;
    synchronized (this) {
      closed = true;
      running = thread;
    }
    synchronized (pauseLock) {
      pauseLock.notifyAll();
    }
    if (running != null && running != Thread.currentThread()) {
      try {
        running.join(TimeUnit.SECONDS.toMillis(5));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private final class StaleProcessingSweep implements PeriodicTask {
    @Override
    public void run(Instant now) throws SQLException {
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        int requeued = jobStore.requeueStale(conn, now.minus(staleProcessingTimeout), now);
        if (requeued > 0) {
          metrics.recordLeaseRequeued(requeued);
          logger.log(Level.WARNING, "Requeued {0} jobs stuck in processing for more than {1}",
              new Object[]{requeued, staleProcessingTimeout});
        }
      }
    }

    @Override
    public String name() {
      return "stale-processing-sweep";
    }
  }

  /**
   * Builder for {@link JobWorker}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private JobDispatcher dispatcher;
    private Clock clock;
    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration periodicCheckInterval = Duration.ofMinutes(5);
    private Duration slowJobThreshold = Duration.ofSeconds(5);
    private Set<String> excludedTypes = Set.of(JobType.SEND_TO_GROUPS.value());
    private int retryCeiling = 3;
    private boolean runOnce;
    private int runOnceAttempts = 3;
    private Duration runOnceRetryDelay = Duration.ofSeconds(1);
    private Duration staleProcessingTimeout;
    private final List<PeriodicTask> periodicTasks = new ArrayList<>();
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * <b>Required.</b> Source of connections for claims and status updates.
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * <b>Required.</b> The worker does not close the dispatcher.
     */
    public Builder dispatcher(JobDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /**
     * Clock for claim timestamps and periodic scheduling.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sleep between polls when no job is pending.
     *
     * <p>Optional. Defaults to 2 seconds. After a failed cycle the worker waits twice as long.
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Minimum time between two runs of the periodic tasks.
     *
     * <p>Optional. Defaults to 5 minutes.
     */
    public Builder periodicCheckInterval(Duration periodicCheckInterval) {
      this.periodicCheckInterval = periodicCheckInterval;
      return this;
    }

    /**
     * Dispatch time above which a job is logged as slow.
     *
     * <p>Optional. Defaults to 5 seconds.
     */
    public Builder slowJobThreshold(Duration slowJobThreshold) {
      this.slowJobThreshold = slowJobThreshold;
      return this;
    }

    /**
     * Job types this worker never claims.
     *
     * <p>Optional. Defaults to {@code send_to_groups}, which a dedicated process handles.
     */
    public Builder excludedTypes(Set<String> excludedTypes) {
      this.excludedTypes = Objects.requireNonNull(excludedTypes, "excludedTypes");
      return this;
    }

    /**
     * Failed attempts after which the next failure is final. With the default of 3 a job
     * is tried four times.
     */
    public Builder retryCeiling(int retryCeiling) {
      this.retryCeiling = retryCeiling;
      return this;
    }

    /**
     * Process at most one job, then return from {@link JobWorker#run()}.
     */
    public Builder runOnce(boolean runOnce) {
      this.runOnce = runOnce;
      return this;
    }

    /**
     * Empty polls before run-once mode gives up. Defaults to 3.
     */
    public Builder runOnceAttempts(int runOnceAttempts) {
      this.runOnceAttempts = runOnceAttempts;
      return this;
    }

    /**
     * Wait between empty polls in run-once mode. Defaults to 1 second.
     */
    public Builder runOnceRetryDelay(Duration runOnceRetryDelay) {
      this.runOnceRetryDelay = runOnceRetryDelay;
      return this;
    }

    /**
     * Enables the processing lease: jobs left in {@code processing} for longer than
     * {@code timeout} (e.g. by a crashed worker) are returned to {@code pending} by the
     * periodic check, counting as one failed attempt.
     *
     * <p>Optional. Disabled by default. Choose a timeout well above the slowest handler,
     * or a job still running elsewhere may be claimed twice.
     */
    public Builder staleProcessingTimeout(Duration timeout) {
      this.staleProcessingTimeout = timeout;
      return this;
    }

    /**
     * Adds a task to run on each periodic check, in registration order.
     */
    public Builder periodicTask(PeriodicTask task) {
      this.periodicTasks.add(Objects.requireNonNull(task, "task"));
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if an interval is not positive or a count is out of range
     */
    public JobWorker build() {
      return new JobWorker(this);
    }
  }
}
