/**
 * Per-user sliding-window rate limiting consulted by the dispatcher before side-effecting
 * handlers run.
 *
 * <p>{@link io.jobworker.ratelimit.RateLimitRules} holds the closed table of limited
 * actions; {@link io.jobworker.ratelimit.SlidingWindowRateLimiter} enforces it with an
 * injected {@link java.time.Clock}.
 */
package io.jobworker.ratelimit;
