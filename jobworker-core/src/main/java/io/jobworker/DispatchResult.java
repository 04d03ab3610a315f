package io.jobworker;

import java.util.Objects;

/**
 * Outcome of dispatching a claimed job, inspected by the worker loop to decide the
 * job's next status.
 *
 * <ul>
 *   <li>{@link Ok}: the handler completed; the job is marked {@code completed}.</li>
 *   <li>{@link Retryable}: the attempt failed; the job is requeued until the retry
 *       ceiling is reached, then marked {@code failed}.</li>
 *   <li>{@link Dropped}: the job was deliberately not executed (rate limited, unknown
 *       type, missing fields). It counts as handled and is marked {@code completed}.</li>
 * </ul>
 *
 * @see io.jobworker.dispatch.JobDispatcher#dispatch(io.jobworker.model.Job)
 */
public sealed interface DispatchResult
    permits DispatchResult.Ok, DispatchResult.Retryable, DispatchResult.Dropped {

  /** Singleton success result. */
  Ok OK = new Ok();

  static Ok ok() {
    return OK;
  }

  static Retryable retryable(String reason) {
    return new Retryable(reason, null);
  }

  static Retryable retryable(String reason, Throwable cause) {
    return new Retryable(reason, cause);
  }

  static Dropped dropped(String reason) {
    return new Dropped(reason);
  }

  /**
   * Whether the job should be finished as successful. True for {@link Ok} and
   * {@link Dropped}.
   */
  default boolean isSuccess() {
    return !(this instanceof Retryable);
  }

  /** Handler completed. */
  record Ok() implements DispatchResult {
  }

  /**
   * Attempt failed and may be retried.
   *
   * @param reason short description, stored in logs
   * @param cause the underlying failure, may be null
   */
  record Retryable(String reason, Throwable cause) implements DispatchResult {
    public Retryable {
      Objects.requireNonNull(reason, "reason");
    }
  }

  /**
   * Job intentionally skipped and treated as handled.
   *
   * @param reason why the job was dropped
   */
  record Dropped(String reason) implements DispatchResult {
    public Dropped {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
