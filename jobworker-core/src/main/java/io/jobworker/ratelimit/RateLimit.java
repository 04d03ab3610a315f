package io.jobworker.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * At most {@code maxRequests} allowed actions within any trailing {@code window}.
 */
public record RateLimit(int maxRequests, Duration window) {
  public RateLimit {
    Objects.requireNonNull(window, "window");
    if (maxRequests < 1) {
      throw new IllegalArgumentException("maxRequests must be >= 1");
    }
    if (window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be positive");
    }
  }

  public static RateLimit of(int maxRequests, Duration window) {
    return new RateLimit(maxRequests, window);
  }
}
