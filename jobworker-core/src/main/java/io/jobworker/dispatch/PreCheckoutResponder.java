package io.jobworker.dispatch;

/**
 * Sends the answer for a pre-checkout query to the payment provider.
 */
@FunctionalInterface
public interface PreCheckoutResponder {

  void answer(String queryId, PreCheckoutAnswer answer) throws Exception;
}
