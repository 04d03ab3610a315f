package io.jobworker.dispatch;

import io.jobworker.DispatchResult;

/**
 * Business logic for one job type.
 *
 * <p>Handlers run synchronously on the worker thread. Returning
 * {@link DispatchResult.Retryable} or throwing puts the job back to {@code pending} until the
 * retry ceiling is reached; {@link DispatchResult.Dropped} completes it without a retry.
 *
 * <p>Jobs are delivered at least once. A handler that already fired its side effect before
 * a crash may see the same job again.
 *
 * @see JobHandlerRegistry
 */
@FunctionalInterface
public interface JobHandler {

  /**
   * @param context the job and its decoded payload
   * @return the outcome; {@code null} is treated as {@link DispatchResult#ok()}
   * @throws Exception converted to {@link DispatchResult.Retryable} by the dispatcher
   */
  DispatchResult handle(JobContext context) throws Exception;
}
