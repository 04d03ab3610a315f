package io.jobworker.worker;

import java.time.Instant;

/**
 * Background work the worker runs between jobs, once per periodic check interval.
 *
 * <p>Failures are logged by the worker and do not affect job processing.
 */
@FunctionalInterface
public interface PeriodicTask {

  void run(Instant now) throws Exception;

  default String name() {
    return getClass().getSimpleName();
  }
}
