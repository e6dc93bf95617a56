package com.codeheadsystems.tessera.server.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Storage for fixed-window counters.
 * <p>
 * Implementations must be thread-safe and {@link #incrementAndGet} must be atomic per key:
 * two concurrent calls can never observe the same count.
 */
public interface RateLimitStore {

  /**
   * Increments the counter for {@code key}, starting a new window with count 1 when there is no
   * counter or the current window has ended.
   *
   * @param key    the key
   * @param window window length for a new window
   * @param now    the current time
   * @return the counter after the increment
   */
  RateLimitCounter incrementAndGet(String key, Duration window, Instant now);

  /**
   * Removes counters whose window has ended.
   *
   * @param now the current time
   * @return the number removed
   */
  int purgeExpired(Instant now);
}
