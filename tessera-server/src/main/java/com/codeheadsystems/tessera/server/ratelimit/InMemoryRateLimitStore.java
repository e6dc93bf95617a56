package com.codeheadsystems.tessera.server.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-persistent {@link RateLimitStore} backed by a {@link ConcurrentHashMap}. Counters are
 * per-process, so limits do not hold across replicas. Suitable for development and testing only.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

  private final ConcurrentHashMap<String, RateLimitCounter> counters = new ConcurrentHashMap<>();

  @Override
  public RateLimitCounter incrementAndGet(String key, Duration window, Instant now) {
    return counters.compute(key, (k, current) -> {
      if (current == null || current.isExpired(now)) {
        return new RateLimitCounter(k, now, 1, now.plus(window));
      }
      return current.incremented();
    });
  }

  @Override
  public int purgeExpired(Instant now) {
    AtomicInteger removed = new AtomicInteger();
    counters.forEach((key, counter) -> {
      if (counter.isExpired(now) && counters.remove(key, counter)) {
        removed.incrementAndGet();
      }
    });
    return removed.get();
  }

  public int size() {
    return counters.size();
  }
}
