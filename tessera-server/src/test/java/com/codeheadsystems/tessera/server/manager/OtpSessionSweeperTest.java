package com.codeheadsystems.tessera.server.manager;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tessera.server.otp.OtpSessionStore;
import com.codeheadsystems.tessera.server.ratelimit.RateLimiter;
import com.codeheadsystems.tessera.server.store.SessionStore;
import com.codeheadsystems.tessera.server.webauthn.SecondFactorCloneDetector;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OtpSessionSweeperTest {

  @Mock private OtpSessionStore sessionStore;
  @Mock private RateLimiter rateLimiter;
  @Mock private SecondFactorCloneDetector cloneDetector;
  @Mock private SessionStore tokenStore;

  private OtpSessionSweeper sweeper;

  @AfterEach
  void tearDown() {
    if (sweeper != null) {
      sweeper.shutdown();
    }
  }

  @Test
  void sweep_cleansEveryStore() {
    sweeper = new OtpSessionSweeper(sessionStore, rateLimiter, cloneDetector, tokenStore, Duration.ofHours(1));

    sweeper.sweep();

    verify(sessionStore).cleanupExpired();
    verify(rateLimiter).purgeExpired();
    verify(cloneDetector).purgeExpiredChallenges();
    verify(tokenStore).purgeExpired();
  }

  @Test
  void sweep_failure_isContained() {
    when(sessionStore.cleanupExpired()).thenThrow(new IllegalStateException("store offline"));
    sweeper = new OtpSessionSweeper(sessionStore, rateLimiter, cloneDetector, tokenStore, Duration.ofHours(1));

    assertThatCode(() -> sweeper.sweep()).doesNotThrowAnyException();
  }

  @Test
  void sweep_failingStep_doesNotSkipLaterSteps() {
    when(sessionStore.cleanupExpired()).thenThrow(new IllegalStateException("store offline"));
    when(cloneDetector.purgeExpiredChallenges()).thenThrow(new IllegalStateException("challenges offline"));
    sweeper = new OtpSessionSweeper(sessionStore, rateLimiter, cloneDetector, tokenStore, Duration.ofHours(1));

    sweeper.sweep();

    verify(rateLimiter).purgeExpired();
    verify(tokenStore).purgeExpired();
  }

  @Test
  void runsOnSchedule() {
    sweeper = new OtpSessionSweeper(sessionStore, rateLimiter, cloneDetector, tokenStore, Duration.ofMillis(20));

    verify(sessionStore, timeout(2000).atLeast(2)).cleanupExpired();
    verify(cloneDetector, timeout(2000).atLeast(2)).purgeExpiredChallenges();
  }
}
