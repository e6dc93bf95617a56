package com.codeheadsystems.tessera.server.otp;

import com.codeheadsystems.tessera.crypto.common.ByteUtils;
import com.codeheadsystems.tessera.crypto.common.Hashing;
import com.codeheadsystems.tessera.crypto.common.RandomProvider;
import com.codeheadsystems.tessera.server.audit.AuditEventType;
import com.codeheadsystems.tessera.server.audit.AuditLogEntry;
import com.codeheadsystems.tessera.server.audit.AuditSink;
import com.codeheadsystems.tessera.server.error.AuthFailure;
import com.codeheadsystems.tessera.server.error.ErrorCode;
import com.codeheadsystems.tessera.server.error.Outcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, verifies and expires OTP sessions.
 * <p>
 * Only {@code sha256(identifier)} and {@code sha256(code ∥ saltHex ∥ pepper)} are stored. A
 * session accepts at most {@code maxAttempts} verifications and exactly one success; the attempt
 * is consumed before the code is compared, so concurrent guesses cannot exceed the ceiling.
 * <p>
 * Every verification writes exactly one audit entry.
 */
public class OtpSessionStore {

  private static final Logger log = LoggerFactory.getLogger(OtpSessionStore.class);

  public static final String PEPPER = "tessera-otp-pepper-v1";
  public static final int SALT_LENGTH = 32;
  public static final int SESSION_ID_LENGTH = 16;

  private final OtpSessionRepository repository;
  private final OtpCodeGenerator codeGenerator;
  private final RandomProvider randomProvider;
  private final AuditSink auditSink;
  private final Clock clock;
  private final int maxAttempts;

  /**
   * Instantiates a new Otp session store.
   *
   * @param repository     session storage
   * @param randomProvider source of codes, salts and session ids
   * @param auditSink      audit destination
   * @param clock          time source
   * @param maxAttempts    verification attempts per session
   */
  public OtpSessionStore(OtpSessionRepository repository,
                         RandomProvider randomProvider,
                         AuditSink auditSink,
                         Clock clock,
                         int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    this.repository = repository;
    this.codeGenerator = new OtpCodeGenerator(randomProvider);
    this.randomProvider = randomProvider;
    this.auditSink = auditSink;
    this.clock = clock;
    this.maxAttempts = maxAttempts;
  }

  // ── Creation ─────────────────────────────────────────────────────────────

  /**
   * Creates a session and its code. The returned code must be handed to the dispatcher and then
   * discarded.
   *
   * @param identifier raw destination identifier
   * @param ttl        session lifetime
   * @param clientMeta request context
   * @return the session id and code
   */
  public IssuedOtp createSession(String identifier, Duration ttl, ClientMeta clientMeta) {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("identifier is required");
    }
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    Instant now = clock.instant();
    String code = codeGenerator.generate();
    String saltHex = HexFormat.of().formatHex(randomProvider.randomBytes(SALT_LENGTH));
    String sessionId = randomProvider.urlSafeToken(SESSION_ID_LENGTH);
    String hashedIdentifier = Hashing.sha256Hex(identifier);

    OtpSession session = new OtpSession(sessionId, hashedIdentifier, hashOtp(code, saltHex), saltHex,
        now, now.plus(ttl), 0, false, null, clientMeta);
    repository.save(session);
    audit(AuditEventType.OTP_SESSION_CREATED, hashedIdentifier, now,
        Map.of("sessionId", sessionId, "expiresAt", session.expiresAt().toString()));
    log.debug("createSession({})", Hashing.forLogging(identifier));
    return new IssuedOtp(sessionId, code, hashedIdentifier, session.expiresAt());
  }

  /**
   * Creates a session with a lifetime in minutes.
   *
   * @param identifier raw destination identifier
   * @param ttlMinutes session lifetime in minutes
   * @param clientMeta request context
   * @return the session id and code
   */
  public IssuedOtp createSession(String identifier, int ttlMinutes, ClientMeta clientMeta) {
    return createSession(identifier, Duration.ofMinutes(ttlMinutes), clientMeta);
  }

  // ── Verification ─────────────────────────────────────────────────────────

  /**
   * Checks a code against a session.
   * <p>
   * Failures are checked in order: not found, already used, expired, attempts exhausted. A wrong
   * code on a verifiable session is a successful outcome with {@code success=false}.
   *
   * @param sessionId    the session id
   * @param suppliedCode the code entered by the user
   * @return the verification, or the failure
   */
  public Outcome<OtpVerification> verifySession(String sessionId, String suppliedCode) {
    Instant now = clock.instant();
    if (sessionId == null || sessionId.isBlank()) {
      return classifyUnverifiable(null, now);
    }
    Optional<OtpSession> attempt = repository.incrementAttemptsIfVerifiable(sessionId, maxAttempts, now);
    if (attempt.isEmpty()) {
      return classifyUnverifiable(sessionId, now);
    }
    OtpSession session = attempt.get();
    int remaining = Math.max(0, maxAttempts - session.attempts());
    String candidate = hashOtp(suppliedCode == null ? "" : suppliedCode, session.salt());

    if (!ByteUtils.constantTimeEquals(candidate, session.otpHash())) {
      audit(AuditEventType.OTP_VERIFY_FAILED, session.hashedIdentifier(), now,
          Map.of("sessionId", sessionId, "attempts", String.valueOf(session.attempts())));
      log.debug("verifySession: mismatch, {} attempt(s) remaining", remaining);
      return Outcome.success(new OtpVerification(false, session.hashedIdentifier(), remaining));
    }
    if (!repository.markUsedIfUnused(sessionId, now)) {
      // a concurrent verification succeeded first
      audit(AuditEventType.OTP_SESSION_ALREADY_USED, session.hashedIdentifier(), now,
          Map.of("sessionId", sessionId));
      return Outcome.failure(ErrorCode.ALREADY_USED);
    }
    audit(AuditEventType.OTP_VERIFIED, session.hashedIdentifier(), now, Map.of("sessionId", sessionId));
    log.debug("verifySession: success");
    return Outcome.success(new OtpVerification(true, session.hashedIdentifier(), remaining));
  }

  private Outcome<OtpVerification> classifyUnverifiable(String sessionId, Instant now) {
    Optional<OtpSession> found = sessionId == null ? Optional.empty() : repository.find(sessionId);
    if (found.isEmpty()) {
      audit(AuditEventType.OTP_SESSION_NOT_FOUND, null, now, Map.of());
      return Outcome.failure(ErrorCode.NOT_FOUND);
    }
    OtpSession session = found.get();
    Map<String, String> details = Map.of("sessionId", session.sessionId());
    if (session.used()) {
      audit(AuditEventType.OTP_SESSION_ALREADY_USED, session.hashedIdentifier(), now, details);
      return Outcome.failure(ErrorCode.ALREADY_USED);
    }
    if (session.isExpired(now)) {
      audit(AuditEventType.OTP_SESSION_EXPIRED, session.hashedIdentifier(), now, details);
      return Outcome.failure(ErrorCode.EXPIRED);
    }
    audit(AuditEventType.OTP_ATTEMPTS_EXCEEDED, session.hashedIdentifier(), now, details);
    return Outcome.failure(new AuthFailure(ErrorCode.ATTEMPTS_EXCEEDED,
        ErrorCode.ATTEMPTS_EXCEEDED.message(), null, 0));
  }

  // ── Maintenance ──────────────────────────────────────────────────────────

  /**
   * Removes expired sessions. Idempotent and safe to run concurrently with verification.
   *
   * @return the number removed
   */
  public int cleanupExpired() {
    Instant now = clock.instant();
    int removed = repository.deleteExpired(now);
    if (removed > 0) {
      audit(AuditEventType.OTP_SESSIONS_PURGED, null, now, Map.of("count", String.valueOf(removed)));
      log.debug("cleanupExpired: removed {}", removed);
    }
    return removed;
  }

  public OtpStatistics statistics() {
    return new OtpStatistics(repository.count(), repository.countExpired(clock.instant()));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  static String hashOtp(String code, String saltHex) {
    return Hashing.sha256Hex(code + saltHex + PEPPER);
  }

  private void audit(AuditEventType type, String subjectHash, Instant now, Map<String, String> details) {
    auditSink.record(new AuditLogEntry(type, subjectHash, now, details));
  }
}
