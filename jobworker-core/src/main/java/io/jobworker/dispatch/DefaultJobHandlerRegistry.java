package io.jobworker.dispatch;

import io.jobworker.model.JobType;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry with one handler per job type.
 *
 * <pre>{@code
 * JobHandlerRegistry registry = new DefaultJobHandlerRegistry()
 *     .register(JobType.NOTIFY_LIVE, liveNotificationHandler)
 *     .register(JobType.BROADCAST_MESSAGE, ctx -> broadcaster.send(ctx.payload()));
 * }</pre>
 */
public final class DefaultJobHandlerRegistry implements JobHandlerRegistry {
  private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

  public DefaultJobHandlerRegistry register(JobType jobType, JobHandler handler) {
    return register(jobType.value(), handler);
  }

  /**
   * Registers a handler for a job type tag.
   *
   * @throws IllegalStateException if the type already has a handler
   */
  public DefaultJobHandlerRegistry register(String jobType, JobHandler handler) {
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(handler, "handler");
    if (handlers.putIfAbsent(jobType, handler) != null) {
      throw new IllegalStateException("Handler already registered for jobType=" + jobType);
    }
    return this;
  }

  @Override
  public Optional<JobHandler> handlerFor(String jobType) {
    return jobType == null ? Optional.empty() : Optional.ofNullable(handlers.get(jobType));
  }
}
