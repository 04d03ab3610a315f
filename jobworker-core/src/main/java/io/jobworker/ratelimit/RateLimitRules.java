package io.jobworker.ratelimit;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable table of {@code action -> RateLimit}. Actions without an entry are unlimited.
 */
public final class RateLimitRules {
  public static final String CHECK_LIVE = "check_live";
  public static final String LIVE_CHECK_LOGIC = "live_check_logic";
  public static final String BUTTON_CLICK = "button_click";
  public static final String PAYMENT = "payment";
  public static final String MESSAGE = "message";

  private final Map<String, RateLimit> limits;

  private RateLimitRules(Map<String, RateLimit> limits) {
    this.limits = Collections.unmodifiableMap(new LinkedHashMap<>(limits));
  }

  /**
   * The production table: {@code check_live} 5/min, {@code live_check_logic} 10/min,
   * {@code button_click} 20/min, {@code payment} 3 per 5 min, {@code message} 10/min.
   */
  public static RateLimitRules defaults() {
    return builder()
        .limit(CHECK_LIVE, 5, Duration.ofSeconds(60))
        .limit(LIVE_CHECK_LOGIC, 10, Duration.ofSeconds(60))
        .limit(BUTTON_CLICK, 20, Duration.ofSeconds(60))
        .limit(PAYMENT, 3, Duration.ofSeconds(300))
        .limit(MESSAGE, 10, Duration.ofSeconds(60))
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<RateLimit> limitFor(String action) {
    return Optional.ofNullable(limits.get(action));
  }

  public Map<String, RateLimit> asMap() {
    return limits;
  }

  public static final class Builder {
    private final Map<String, RateLimit> limits = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder limit(String action, int maxRequests, Duration window) {
      return limit(action, RateLimit.of(maxRequests, window));
    }

    public Builder limit(String action, RateLimit limit) {
      limits.put(Objects.requireNonNull(action, "action"), Objects.requireNonNull(limit, "limit"));
      return this;
    }

    /**
     * Copies every entry of {@code rules}, overwriting entries already present.
     */
    public Builder from(RateLimitRules rules) {
      limits.putAll(rules.limits);
      return this;
    }

    public RateLimitRules build() {
      return new RateLimitRules(limits);
    }
  }
}
