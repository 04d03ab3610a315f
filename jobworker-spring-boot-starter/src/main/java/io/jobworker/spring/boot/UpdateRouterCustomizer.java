package io.jobworker.spring.boot;

import io.jobworker.dispatch.UpdateRouter;

/**
 * Callback for adding command, callback and payment handlers to the auto-configured
 * {@link UpdateRouter}.
 */
@FunctionalInterface
public interface UpdateRouterCustomizer {

  void customize(UpdateRouter.Builder builder);
}
