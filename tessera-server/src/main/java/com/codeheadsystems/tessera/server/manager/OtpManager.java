package com.codeheadsystems.tessera.server.manager;

import com.codeheadsystems.tessera.crypto.common.Hashing;
import com.codeheadsystems.tessera.model.otp.InitiateRequest;
import com.codeheadsystems.tessera.model.otp.InitiateResponse;
import com.codeheadsystems.tessera.model.otp.VerifyRequest;
import com.codeheadsystems.tessera.model.otp.VerifyResponse;
import com.codeheadsystems.tessera.server.audit.AuditEventType;
import com.codeheadsystems.tessera.server.audit.AuditLogEntry;
import com.codeheadsystems.tessera.server.audit.AuditSink;
import com.codeheadsystems.tessera.server.auth.AuthMethod;
import com.codeheadsystems.tessera.server.auth.JwtManager;
import com.codeheadsystems.tessera.server.config.TesseraConfig;
import com.codeheadsystems.tessera.server.error.AuthFailure;
import com.codeheadsystems.tessera.server.error.Outcome;
import com.codeheadsystems.tessera.server.otp.ClientMeta;
import com.codeheadsystems.tessera.server.otp.CodeDispatcher;
import com.codeheadsystems.tessera.server.otp.IssuedOtp;
import com.codeheadsystems.tessera.server.otp.OtpSessionStore;
import com.codeheadsystems.tessera.server.otp.OtpVerification;
import com.codeheadsystems.tessera.server.ratelimit.RateLimitScope;
import com.codeheadsystems.tessera.server.ratelimit.RateLimiter;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service behind {@code POST /otp/initiate} and {@code POST /otp/verify}.
 * <p>
 * Adapters ({@code OtpResource} for JAX-RS / Dropwizard, {@code OtpController} for Spring Boot)
 * only translate the returned {@link Outcome} into an HTTP response; the status for each failure
 * is {@link com.codeheadsystems.tessera.server.error.ErrorCode#httpStatus()}.
 */
public class OtpManager {

  private static final Logger log = LoggerFactory.getLogger(OtpManager.class);

  private static final String UNKNOWN_ADDRESS = "unknown";

  private final TesseraConfig config;
  private final OtpSessionStore sessionStore;
  private final RateLimiter rateLimiter;
  private final CodeDispatcher dispatcher;
  private final JwtManager jwtManager;
  private final AuditSink auditSink;

  /**
   * Instantiates a new Otp manager.
   *
   * @param config       runtime configuration
   * @param sessionStore OTP sessions
   * @param rateLimiter  rate limiter
   * @param dispatcher   code delivery
   * @param jwtManager   session token issuer
   * @param auditSink    audit destination
   */
  public OtpManager(TesseraConfig config,
                    OtpSessionStore sessionStore,
                    RateLimiter rateLimiter,
                    CodeDispatcher dispatcher,
                    JwtManager jwtManager,
                    AuditSink auditSink) {
    this.config = config;
    this.sessionStore = sessionStore;
    this.rateLimiter = rateLimiter;
    this.dispatcher = dispatcher;
    this.jwtManager = jwtManager;
    this.auditSink = auditSink;
  }

  /**
   * Rate-limits by address then by identifier, creates a session and dispatches its code.
   * A delivery failure is logged and audited but the session stays valid. The code is only
   * echoed in the response outside production.
   *
   * @param request    the request
   * @param clientMeta request context
   * @return the session handle, or a {@code VALIDATION} / {@code RATE_LIMITED} failure
   */
  public Outcome<InitiateResponse> initiate(InitiateRequest request, ClientMeta clientMeta) {
    String identifier;
    try {
      identifier = requireBody(request).requireIdentifier();
    } catch (IllegalArgumentException e) {
      return Outcome.failure(AuthFailure.validation(e.getMessage()));
    }
    ClientMeta meta = clientMeta == null ? ClientMeta.EMPTY : clientMeta;
    Optional<AuthFailure> limited = rateLimiter.enforce(RateLimitScope.OTP_INITIATE_IP, address(meta))
        .or(() -> rateLimiter.enforce(RateLimitScope.OTP_INITIATE_IDENTIFIER, identifier));
    if (limited.isPresent()) {
      log.debug("initiate({}) rate limited", Hashing.forLogging(identifier));
      return Outcome.failure(limited.get());
    }

    IssuedOtp issued = sessionStore.createSession(identifier, config.otpTtl(), meta);
    try {
      dispatcher.dispatch(identifier, issued.code(), config.otpTtl());
    } catch (RuntimeException e) {
      log.warn("Code delivery failed for {}: {}", Hashing.forLogging(identifier), e.toString());
      auditSink.record(new AuditLogEntry(AuditEventType.OTP_DISPATCH_FAILED, issued.hashedIdentifier(),
          rateLimiter.clock().instant(), Map.of("sessionId", issued.sessionId(),
          "error", e.getClass().getSimpleName())));
    }
    String exposedCode = config.isProduction() ? null : issued.code();
    return Outcome.success(new InitiateResponse(issued.sessionId(), config.otpTtl().toSeconds(), exposedCode));
  }

  /**
   * Rate-limits by address and by session, then verifies the code. A session token is issued on
   * success.
   *
   * @param request    the request
   * @param clientMeta request context
   * @return the verification result, or the failure
   */
  public Outcome<VerifyResponse> verify(VerifyRequest request, ClientMeta clientMeta) {
    String sessionId;
    String code;
    try {
      VerifyRequest body = requireBody(request);
      sessionId = body.requireSessionId();
      code = body.requireCode();
    } catch (IllegalArgumentException e) {
      return Outcome.failure(AuthFailure.validation(e.getMessage()));
    }
    ClientMeta meta = clientMeta == null ? ClientMeta.EMPTY : clientMeta;
    Optional<AuthFailure> limited = rateLimiter.enforce(RateLimitScope.OTP_VERIFY_IP, address(meta))
        .or(() -> rateLimiter.enforce(RateLimitScope.OTP_VERIFY_SESSION, sessionId));
    if (limited.isPresent()) {
      return Outcome.failure(limited.get());
    }

    Outcome<OtpVerification> outcome = sessionStore.verifySession(sessionId, code);
    return outcome.map(v -> v.success()
        ? new VerifyResponse(true, v.attemptsRemaining(), jwtManager.issueToken(v.hashedIdentifier(), AuthMethod.OTP))
        : new VerifyResponse(false, v.attemptsRemaining(), null));
  }

  private static String address(ClientMeta meta) {
    return meta.ipAddress() == null ? UNKNOWN_ADDRESS : meta.ipAddress();
  }

  private static <T> T requireBody(T body) {
    if (body == null) {
      throw new IllegalArgumentException("Missing request body");
    }
    return body;
  }
}
