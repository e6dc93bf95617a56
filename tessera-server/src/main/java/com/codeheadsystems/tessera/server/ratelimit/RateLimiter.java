package com.codeheadsystems.tessera.server.ratelimit;

import com.codeheadsystems.tessera.crypto.common.Hashing;
import com.codeheadsystems.tessera.server.audit.AuditEventType;
import com.codeheadsystems.tessera.server.audit.AuditLogEntry;
import com.codeheadsystems.tessera.server.audit.AuditSink;
import com.codeheadsystems.tessera.server.error.AuthFailure;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-window rate limiter.
 * <p>
 * The first request of a window sets the count to 1; the request that takes the count above the
 * limit and every later one in the same window are denied. Subjects are hashed with
 * {@link Hashing#forRateLimit} before they become keys, so raw identifiers and IP addresses never
 * reach the store.
 * <p>
 * A store failure fails open: the request is allowed, logged and audited as
 * {@link AuditEventType#RATE_LIMIT_FAIL_OPEN}.
 */
public class RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

  private final RateLimitStore store;
  private final Map<RateLimitScope, RateLimitRule> rules;
  private final AuditSink auditSink;
  private final Clock clock;

  /**
   * Instantiates a new Rate limiter.
   *
   * @param store     counter storage
   * @param rules     limits per scope; every scope must have a rule
   * @param auditSink destination for violation events
   * @param clock     time source
   */
  public RateLimiter(RateLimitStore store, Map<RateLimitScope, RateLimitRule> rules,
                     AuditSink auditSink, Clock clock) {
    for (RateLimitScope scope : RateLimitScope.values()) {
      if (!rules.containsKey(scope)) {
        throw new IllegalArgumentException("No rate limit rule for " + scope);
      }
    }
    this.store = store;
    this.rules = new EnumMap<>(rules);
    this.auditSink = auditSink;
    this.clock = clock;
  }

  /**
   * Counts a request for {@code subject} in {@code scope} using the configured rule.
   *
   * @param scope   the namespace
   * @param subject raw identifier, IP address or session id; hashed before use
   * @return the decision
   */
  public RateLimitDecision checkAndConsume(RateLimitScope scope, String subject) {
    RateLimitRule rule = rules.get(scope);
    String key = scope.prefix() + ":" + Hashing.forRateLimit(subject == null ? "" : subject);
    return checkAndConsume(key, rule.limit(), rule.window());
  }

  /**
   * Counts a request and converts a denial into a {@code RATE_LIMITED} failure.
   *
   * @param scope   the namespace
   * @param subject raw identifier, IP address or session id; hashed before use
   * @return the failure when denied, empty when allowed
   */
  public Optional<AuthFailure> enforce(RateLimitScope scope, String subject) {
    RateLimitDecision decision = checkAndConsume(scope, subject);
    if (decision.allowed()) {
      return Optional.empty();
    }
    return Optional.of(AuthFailure.rateLimited(decision.retryAfter(clock.instant())));
  }

  /**
   * Counts a request against an explicit key and limit.
   *
   * @param key           the store key
   * @param limit         requests allowed per window
   * @param windowMinutes window length in minutes
   * @return the decision
   */
  public RateLimitDecision checkAndConsume(String key, int limit, int windowMinutes) {
    return checkAndConsume(key, limit, Duration.ofMinutes(windowMinutes));
  }

  /**
   * Counts a request against an explicit key and limit.
   *
   * @param key    the store key
   * @param limit  requests allowed per window
   * @param window window length
   * @return the decision
   */
  public RateLimitDecision checkAndConsume(String key, int limit, Duration window) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    Instant now = clock.instant();
    RateLimitCounter counter;
    try {
      counter = store.incrementAndGet(key, window, now);
    } catch (RuntimeException e) {
      log.warn("Rate limit store failed for key {}; allowing request", key, e);
      auditSink.record(new AuditLogEntry(AuditEventType.RATE_LIMIT_FAIL_OPEN, key, now,
          Map.of("error", e.getClass().getSimpleName())));
      return new RateLimitDecision(true, limit, now.plus(window));
    }
    if (counter.count() > limit) {
      log.debug("Rate limit exceeded for key {} ({} > {})", key, counter.count(), limit);
      auditSink.record(new AuditLogEntry(AuditEventType.RATE_LIMIT_EXCEEDED, key, now,
          Map.of("count", String.valueOf(counter.count()), "limit", String.valueOf(limit))));
      return new RateLimitDecision(false, 0, counter.resetAt());
    }
    return new RateLimitDecision(true, limit - counter.count(), counter.resetAt());
  }

  /**
   * Removes ended windows from the store.
   *
   * @return the number removed
   */
  public int purgeExpired() {
    return store.purgeExpired(clock.instant());
  }

  public Clock clock() {
    return clock;
  }
}
