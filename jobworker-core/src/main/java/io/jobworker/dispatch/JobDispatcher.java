package io.jobworker.dispatch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobworker.DispatchResult;
import io.jobworker.model.Job;
import io.jobworker.model.JobType;
import io.jobworker.util.PayloadCodec;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes a claimed job to its handler and turns the outcome into a {@link DispatchResult}.
 *
 * <p>The payload is decoded once. {@code process_update} jobs go to the
 * {@link UpdateRouter} when one is configured; every other type is looked up in the
 * {@link JobHandlerRegistry}. The dispatcher only reads routing keys and never touches the
 * store; the worker records the result.
 *
 * <ul>
 *   <li>malformed payload: {@link DispatchResult.Retryable}
 *   <li>no handler for the type: {@link DispatchResult.Dropped}
 *   <li>handler exception: {@link DispatchResult.Retryable}
 * </ul>
 *
 * <p>Create instances via {@link #builder()}. Closing the dispatcher closes its router.
 */
public final class JobDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobDispatcher.class.getName());

  private final JobHandlerRegistry registry;
  private final UpdateRouter updateRouter;
  private final PayloadCodec codec;

  private JobDispatcher(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.updateRouter = builder.updateRouter;
    this.codec = builder.codec != null ? builder.codec : PayloadCodec.getDefault();
  }

  public static Builder builder() {
    return new Builder();
  }

  public DispatchResult dispatch(Job job) {
    Objects.requireNonNull(job, "job");
    ObjectNode payload;
    try {
      payload = codec.decode(job.payloadJson());
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Malformed payload for jobId=" + job.jobId(), e);
      return DispatchResult.retryable("Malformed payload", e);
    }

    if (updateRouter != null && JobType.PROCESS_UPDATE.value().equals(job.jobType())) {
      return routeUpdate(job, payload);
    }

    Optional<JobHandler> handler = registry.handlerFor(job.jobType());
    if (handler.isEmpty()) {
      logger.log(Level.WARNING, "Unknown job type {0} for jobId={1}; dropping",
          new Object[]{job.jobType(), job.jobId()});
      return DispatchResult.dropped("No handler for job type " + job.jobType());
    }
    try {
      DispatchResult result = handler.get().handle(new JobContext(job, payload));
      return result == null ? DispatchResult.ok() : result;
    } catch (Exception e) {
      logger.log(Level.WARNING, "Handler failed for jobId=" + job.jobId() + " type=" + job.jobType(), e);
      return DispatchResult.retryable("Handler failed: " + e.getMessage(), e);
    }
  }

  private DispatchResult routeUpdate(Job job, ObjectNode payload) {
    Optional<Update> update = Update.from(payload);
    if (update.isEmpty()) {
      logger.log(Level.FINE, "Update in jobId={0} has no routable content", job.jobId());
      return DispatchResult.ok();
    }
    try {
      return updateRouter.route(update.get());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return DispatchResult.retryable("Interrupted while handling update", e);
    } catch (Exception e) {
      logger.log(Level.WARNING, "Update handler failed for jobId=" + job.jobId(), e);
      return DispatchResult.retryable("Update handler failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    if (updateRouter != null) {
      updateRouter.close();
    }
  }

  /** Builder for {@link JobDispatcher}. */
  public static final class Builder {
    private JobHandlerRegistry registry;
    private UpdateRouter updateRouter;
    private PayloadCodec codec;

    private Builder() {
    }

    /**
     * <b>Required.</b> Handlers for every job type other than routed updates.
     */
    public Builder registry(JobHandlerRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Optional router for {@code process_update} jobs. Without it those jobs are looked
     * up in the registry like any other type.
     */
    public Builder updateRouter(UpdateRouter updateRouter) {
      this.updateRouter = updateRouter;
      return this;
    }

    public Builder codec(PayloadCodec codec) {
      this.codec = codec;
      return this;
    }

    public JobDispatcher build() {
      return new JobDispatcher(this);
    }
  }
}
