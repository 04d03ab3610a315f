package io.jobworker.dispatch;

import java.util.Optional;

/**
 * Looks up the handler for a job type.
 *
 * @see DefaultJobHandlerRegistry
 */
public interface JobHandlerRegistry {

  Optional<JobHandler> handlerFor(String jobType);
}
