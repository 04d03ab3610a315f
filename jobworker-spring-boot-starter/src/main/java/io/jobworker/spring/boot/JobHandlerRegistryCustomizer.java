package io.jobworker.spring.boot;

import io.jobworker.dispatch.DefaultJobHandlerRegistry;

/**
 * Callback for registering {@link io.jobworker.dispatch.JobHandler}s with the
 * auto-configured registry.
 *
 * <pre>{@code
 * @Bean
 * JobHandlerRegistryCustomizer broadcastHandler(Broadcaster broadcaster) {
 *   return registry -> registry.register(JobType.BROADCAST_MESSAGE, broadcaster::send);
 * }
 * }</pre>
 */
@FunctionalInterface
public interface JobHandlerRegistryCustomizer {

  void customize(DefaultJobHandlerRegistry registry);
}
