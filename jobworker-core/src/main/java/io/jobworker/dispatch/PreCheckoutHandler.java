package io.jobworker.dispatch;

/**
 * Validates a pre-checkout query.
 *
 * <p>Runs under the pre-checkout deadline; if it does not return in time the query is
 * rejected on its behalf and its result is discarded.
 */
@FunctionalInterface
public interface PreCheckoutHandler {

  PreCheckoutAnswer check(Update.PreCheckoutQuery query) throws Exception;
}
