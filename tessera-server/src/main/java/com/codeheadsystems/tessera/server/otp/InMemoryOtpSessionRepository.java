package com.codeheadsystems.tessera.server.otp;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Non-persistent {@link OtpSessionRepository} backed by a {@link ConcurrentHashMap}. Conditional
 * updates run inside {@link ConcurrentHashMap#computeIfPresent}, which is atomic per key.
 * Sessions are lost on restart. Suitable for development and testing only.
 */
public class InMemoryOtpSessionRepository implements OtpSessionRepository {

  private final ConcurrentHashMap<String, OtpSession> sessions = new ConcurrentHashMap<>();

  @Override
  public void save(OtpSession session) {
    sessions.put(session.sessionId(), session);
  }

  @Override
  public Optional<OtpSession> find(String sessionId) {
    return Optional.ofNullable(sessions.get(sessionId));
  }

  @Override
  public Optional<OtpSession> incrementAttemptsIfVerifiable(String sessionId, int maxAttempts, Instant now) {
    AtomicReference<OtpSession> updated = new AtomicReference<>();
    sessions.computeIfPresent(sessionId, (id, session) -> {
      if (session.used() || session.isExpired(now) || session.attempts() >= maxAttempts) {
        return session;
      }
      OtpSession next = session.withAttempt();
      updated.set(next);
      return next;
    });
    return Optional.ofNullable(updated.get());
  }

  @Override
  public boolean markUsedIfUnused(String sessionId, Instant now) {
    AtomicBoolean marked = new AtomicBoolean();
    sessions.computeIfPresent(sessionId, (id, session) -> {
      if (session.used()) {
        return session;
      }
      marked.set(true);
      return session.markUsed(now);
    });
    return marked.get();
  }

  @Override
  public int deleteExpired(Instant now) {
    AtomicInteger removed = new AtomicInteger();
    sessions.forEach((id, session) -> {
      if (session.isExpired(now) && sessions.remove(id, session)) {
        removed.incrementAndGet();
      }
    });
    return removed.get();
  }

  @Override
  public long count() {
    return sessions.size();
  }

  @Override
  public long countExpired(Instant now) {
    return sessions.values().stream().filter(s -> s.isExpired(now)).count();
  }
}
