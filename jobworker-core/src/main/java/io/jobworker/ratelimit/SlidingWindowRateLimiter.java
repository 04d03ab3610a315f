package io.jobworker.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-local sliding-window rate limiter keyed by (subject, action).
 *
 * <p>Each key holds the instants of its recent allowed actions. A call to
 * {@link #allowed} first discards instants at or before {@code now - window}; the action
 * is allowed (and recorded) only while fewer than {@code maxRequests} instants remain.
 * Rejected calls are not recorded.
 *
 * <p>Idle keys are swept opportunistically from within {@link #allowed}, at most once per
 * sweep interval. State is never persisted and is lost on restart.
 *
 * <p>This class is thread-safe.
 */
public final class SlidingWindowRateLimiter {
  private static final Logger logger = Logger.getLogger(SlidingWindowRateLimiter.class.getName());

  /** Default interval between opportunistic sweeps. */
  public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(10);

  private final RateLimitRules rules;
  private final Clock clock;
  private final Duration sweepInterval;
  private final Map<Key, Deque<Instant>> windows = new HashMap<>();
  private Instant lastSweep;

  public SlidingWindowRateLimiter(RateLimitRules rules, Clock clock) {
    this(rules, clock, DEFAULT_SWEEP_INTERVAL);
  }

  public SlidingWindowRateLimiter(RateLimitRules rules, Clock clock, Duration sweepInterval) {
    this.rules = Objects.requireNonNull(rules, "rules");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
    if (sweepInterval.isNegative() || sweepInterval.isZero()) {
      throw new IllegalArgumentException("sweepInterval must be positive");
    }
    this.lastSweep = clock.instant();
  }

  /**
   * Checks and records one action for {@code subject}.
   *
   * @return {@code true} if the action is within its limit (or has no limit)
   */
  public synchronized boolean allowed(String subject, String action) {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(action, "action");
    Optional<RateLimit> rule = rules.limitFor(action);
    if (rule.isEmpty()) {
      return true;
    }
    Instant now = clock.instant();
    sweepIfDue(now);

    RateLimit limit = rule.get();
    Deque<Instant> window = windows.computeIfAbsent(new Key(subject, action), k -> new ArrayDeque<>());
    trim(window, now.minus(limit.window()));
    if (window.size() >= limit.maxRequests()) {
      logger.log(Level.FINE, "Rate limit hit for subject={0} action={1}", new Object[]{subject, action});
      return false;
    }
    window.addLast(now);
    return true;
  }

  /**
   * Whole seconds until the oldest recorded action for this key leaves the window.
   *
   * <p>Returns 0 when nothing is recorded or the action has no limit. Read-only apart
   * from trimming expired instants.
   */
  public synchronized long resetInSeconds(String subject, String action) {
    Optional<RateLimit> rule = rules.limitFor(action);
    if (rule.isEmpty()) {
      return 0L;
    }
    Deque<Instant> window = windows.get(new Key(subject, action));
    if (window == null) {
      return 0L;
    }
    Instant now = clock.instant();
    Duration length = rule.get().window();
    trim(window, now.minus(length));
    Instant oldest = window.peekFirst();
    if (oldest == null) {
      return 0L;
    }
    long remaining = Duration.between(now, oldest.plus(length)).getSeconds();
    return Math.max(0L, remaining);
  }

  /**
   * Number of (subject, action) keys currently tracked.
   */
  public synchronized int trackedKeys() {
    return windows.size();
  }

  /**
   * Drops expired instants from every key and forgets keys left empty.
   */
  public synchronized void sweep() {
    Instant now = clock.instant();
    Iterator<Map.Entry<Key, Deque<Instant>>> it = windows.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<Key, Deque<Instant>> entry = it.next();
      Optional<RateLimit> rule = rules.limitFor(entry.getKey().action());
      if (rule.isEmpty()) {
        it.remove();
        continue;
      }
      trim(entry.getValue(), now.minus(rule.get().window()));
      if (entry.getValue().isEmpty()) {
        it.remove();
      }
    }
    lastSweep = now;
  }

  private void sweepIfDue(Instant now) {
    if (!now.isBefore(lastSweep.plus(sweepInterval))) {
      sweep();
    }
  }

  // Removes instants at or before the cutoff.
  private static void trim(Deque<Instant> window, Instant cutoff) {
    while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
      window.pollFirst();
    }
  }

  private record Key(String subject, String action) {
  }
}
