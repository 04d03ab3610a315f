package io.jobworker.dispatch;

import io.jobworker.DispatchResult;

/**
 * Handles a callback button press. Only invoked after the sender passed the
 * {@code button_click} rate limit.
 */
@FunctionalInterface
public interface CallbackHandler {

  DispatchResult handle(Update.CallbackQuery query, CallbackAction action) throws Exception;
}
