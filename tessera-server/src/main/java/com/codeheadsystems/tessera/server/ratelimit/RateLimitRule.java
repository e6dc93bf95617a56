package com.codeheadsystems.tessera.server.ratelimit;

import java.time.Duration;

/**
 * At most {@code limit} requests per fixed {@code window}.
 *
 * @param limit  requests allowed per window
 * @param window window length
 */
public record RateLimitRule(int limit, Duration window) {

  public RateLimitRule {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    if (window == null || window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be positive");
    }
  }

  public static RateLimitRule perMinute(int limit) {
    return new RateLimitRule(limit, Duration.ofMinutes(1));
  }

  public static RateLimitRule perHour(int limit) {
    return new RateLimitRule(limit, Duration.ofHours(1));
  }
}
