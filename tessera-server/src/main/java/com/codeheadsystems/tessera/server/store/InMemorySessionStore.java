package com.codeheadsystems.tessera.server.store;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired sessions are evicted on {@link #load} and by {@link #purgeExpired}. All sessions are
 * lost on restart.
 * Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, SessionData> store = new ConcurrentHashMap<>();
  // subject -> jtis, kept in sync with store
  private final ConcurrentHashMap<String, Set<String>> subjectToJtis = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  public InMemorySessionStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void store(String jti, SessionData sessionData) {
    store.put(jti, sessionData);
    subjectToJtis.compute(sessionData.subject(), (k, jtis) -> {
      Set<String> set = jtis == null ? ConcurrentHashMap.newKeySet() : jtis;
      set.add(jti);
      return set;
    });
    log.debug("Stored session jti={}", jti);
  }

  @Override
  public Optional<SessionData> load(String jti) {
    SessionData data = store.get(jti);
    if (data == null) {
      return Optional.empty();
    }
    if (data.expiresAt().isBefore(clock.instant())) {
      revoke(jti);
      return Optional.empty();
    }
    return Optional.of(data);
  }

  @Override
  public void revoke(String jti) {
    SessionData data = store.remove(jti);
    if (data != null) {
      unindex(data.subject(), jti);
    }
    log.debug("Revoked session jti={}", jti);
  }

  @Override
  public int revokeBySubject(String subject) {
    Set<String> jtis = subjectToJtis.remove(subject);
    if (jtis == null) {
      return 0;
    }
    jtis.forEach(store::remove);
    log.debug("Revoked {} session(s) for subject", jtis.size());
    return jtis.size();
  }

  @Override
  public int purgeExpired() {
    Instant now = clock.instant();
    AtomicInteger removed = new AtomicInteger();
    store.forEach((jti, data) -> {
      if (data.expiresAt().isBefore(now) && store.remove(jti, data)) {
        unindex(data.subject(), jti);
        removed.incrementAndGet();
      }
    });
    if (removed.get() > 0) {
      log.debug("Purged {} expired session(s)", removed.get());
    }
    return removed.get();
  }

  public int size() {
    return store.size();
  }

  int subjectCount() {
    return subjectToJtis.size();
  }

  // drops the subject entry once its last jti is gone
  private void unindex(String subject, String jti) {
    subjectToJtis.computeIfPresent(subject, (k, jtis) -> {
      jtis.remove(jti);
      return jtis.isEmpty() ? null : jtis;
    });
  }
}
