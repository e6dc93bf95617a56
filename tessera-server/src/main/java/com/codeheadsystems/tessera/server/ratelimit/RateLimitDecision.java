package com.codeheadsystems.tessera.server.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of {@link RateLimiter#checkAndConsume}.
 *
 * @param allowed   whether the request may proceed
 * @param remaining requests left in the current window
 * @param resetTime end of the current window
 */
public record RateLimitDecision(boolean allowed, int remaining, Instant resetTime) {

  public Duration retryAfter(Instant now) {
    Duration wait = Duration.between(now, resetTime);
    return wait.isNegative() ? Duration.ZERO : wait;
  }
}
