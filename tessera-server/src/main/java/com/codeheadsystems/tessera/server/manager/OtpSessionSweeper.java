package com.codeheadsystems.tessera.server.manager;

import com.codeheadsystems.tessera.server.otp.OtpSessionStore;
import com.codeheadsystems.tessera.server.ratelimit.RateLimiter;
import com.codeheadsystems.tessera.server.store.SessionStore;
import com.codeheadsystems.tessera.server.webauthn.SecondFactorCloneDetector;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically removes expired OTP sessions, ended rate-limit windows, expired WebAuthn
 * challenges and expired session tokens, keeping the cleanup off the request path.
 */
public class OtpSessionSweeper {

  private static final Logger log = LoggerFactory.getLogger(OtpSessionSweeper.class);

  private final OtpSessionStore sessionStore;
  private final RateLimiter rateLimiter;
  private final SecondFactorCloneDetector cloneDetector;
  private final SessionStore tokenStore;

  private final ScheduledExecutorService sweeper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "tessera-expiry-sweeper");
        t.setDaemon(true);
        return t;
      });

  /**
   * Starts sweeping every {@code interval}.
   *
   * @param sessionStore  OTP sessions
   * @param rateLimiter   rate limiter
   * @param cloneDetector WebAuthn challenges
   * @param tokenStore    issued session tokens
   * @param interval      sweep period
   */
  public OtpSessionSweeper(OtpSessionStore sessionStore,
                           RateLimiter rateLimiter,
                           SecondFactorCloneDetector cloneDetector,
                           SessionStore tokenStore,
                           Duration interval) {
    this.sessionStore = sessionStore;
    this.rateLimiter = rateLimiter;
    this.cloneDetector = cloneDetector;
    this.tokenStore = tokenStore;
    long millis = interval.toMillis();
    sweeper.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one sweep. Each step runs on its own; a failing step is logged and neither skips the
   * remaining steps nor stops later sweeps.
   */
  public void sweep() {
    int sessions = purge("OTP sessions", sessionStore::cleanupExpired);
    int windows = purge("rate-limit windows", rateLimiter::purgeExpired);
    int challenges = purge("WebAuthn challenges", cloneDetector::purgeExpiredChallenges);
    int tokens = purge("session tokens", tokenStore::purgeExpired);
    log.debug("sweep: sessions={} windows={} challenges={} tokens={}", sessions, windows, challenges, tokens);
  }

  // an exception escaping sweep() would cancel the schedule
  private int purge(String what, IntSupplier step) {
    try {
      return step.getAsInt();
    } catch (RuntimeException e) {
      log.error("Expiry sweep of {} failed", what, e);
      return 0;
    }
  }

  /**
   * Shuts down the sweeper thread.
   * <p>
   * In Dropwizard this runs from the bundle's {@code Managed} lifecycle; in Spring Boot the bean
   * is declared with {@code @Bean(destroyMethod = "shutdown")}.
   */
  public void shutdown() {
    sweeper.shutdown();
  }
}
