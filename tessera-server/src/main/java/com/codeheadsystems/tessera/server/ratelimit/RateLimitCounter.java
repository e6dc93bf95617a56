package com.codeheadsystems.tessera.server.ratelimit;

import java.time.Instant;

/**
 * Fixed-window counter for one key.
 *
 * @param key         hashed, scope-prefixed key
 * @param windowStart start of the window
 * @param count       requests seen in the window, including the current one
 * @param resetAt     end of the window
 */
public record RateLimitCounter(String key, Instant windowStart, int count, Instant resetAt) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(resetAt);
  }

  /**
   * The same window with one more request. The count saturates at {@link Integer#MAX_VALUE}.
   *
   * @return the incremented counter
   */
  public RateLimitCounter incremented() {
    int next = count == Integer.MAX_VALUE ? count : count + 1;
    return new RateLimitCounter(key, windowStart, next, resetAt);
  }
}
