package com.codeheadsystems.tessera.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.codeheadsystems.tessera.server.MutableClock;
import com.codeheadsystems.tessera.server.auth.AuthMethod;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySessionStoreTest {

  private MutableClock clock;
  private InMemorySessionStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    store = new InMemorySessionStore(clock);
  }

  private SessionData session(String subject) {
    return new SessionData(subject, AuthMethod.OTP, clock.instant(), clock.instant().plusSeconds(3600));
  }

  @Test
  void storeAndLoad_roundTrip() {
    SessionData data = session("subject");
    store.store("jti-1", data);

    assertThat(store.load("jti-1")).contains(data);
  }

  @Test
  void load_notFound_returnsEmpty() {
    assertThat(store.load("nonexistent")).isEmpty();
  }

  @Test
  void load_expired_returnsEmptyAndEvicts() {
    store.store("jti-expired", session("subject"));
    clock.advance(Duration.ofHours(2));

    assertThat(store.load("jti-expired")).isEmpty();
    clock.advance(Duration.ofHours(-2));
    assertThat(store.load("jti-expired")).isEmpty();
  }

  @Test
  void revoke_removesSession() {
    store.store("jti-revoke", session("subject"));

    store.revoke("jti-revoke");
    assertThat(store.load("jti-revoke")).isEmpty();
  }

  @Test
  void revokeBySubject_removesAllSessionsForSubject_leavesOthersIntact() {
    store.store("jti-a1", session("subject-a"));
    store.store("jti-a2", session("subject-a"));
    store.store("jti-b1", session("subject-b"));

    assertThat(store.revokeBySubject("subject-a")).isEqualTo(2);

    assertThat(store.load("jti-a1")).isEmpty();
    assertThat(store.load("jti-a2")).isEmpty();
    assertThat(store.load("jti-b1")).isPresent();
  }

  @Test
  void revokeBySubject_afterSingleRevoke_countsRemainingOnly() {
    store.store("jti-a1", session("subject-a"));
    store.store("jti-a2", session("subject-a"));
    store.revoke("jti-a1");

    assertThat(store.revokeBySubject("subject-a")).isEqualTo(1);
  }

  @Test
  void revokeBySubject_unknownSubject_doesNotThrow() {
    assertThatCode(() -> store.revokeBySubject("nonexistent")).doesNotThrowAnyException();
    assertThat(store.revokeBySubject("nonexistent")).isZero();
  }

  @Test
  void purgeExpired_removesExpiredSessionsAndEmptySubjects() {
    store.store("jti-old-a", session("subject-a"));
    store.store("jti-old-b", session("subject-b"));
    clock.advance(Duration.ofMinutes(30));
    store.store("jti-new-b", session("subject-b"));
    clock.advance(Duration.ofMinutes(31));

    assertThat(store.purgeExpired()).isEqualTo(2);

    assertThat(store.size()).isEqualTo(1);
    assertThat(store.subjectCount()).isEqualTo(1);
    assertThat(store.load("jti-new-b")).isPresent();
    assertThat(store.purgeExpired()).isZero();
  }

  @Test
  void revoke_lastSession_dropsSubjectIndex() {
    store.store("jti-1", session("subject"));

    store.revoke("jti-1");

    assertThat(store.subjectCount()).isZero();
  }
}
