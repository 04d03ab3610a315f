package io.jobworker.dispatch;

import io.jobworker.DispatchResult;

/**
 * Handles a chat message matched by command prefix, or a successful-payment message.
 */
@FunctionalInterface
public interface MessageHandler {

  DispatchResult handle(Update.Message message) throws Exception;
}
