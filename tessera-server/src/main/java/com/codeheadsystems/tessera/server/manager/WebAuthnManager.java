package com.codeheadsystems.tessera.server.manager;

import com.codeheadsystems.tessera.crypto.common.Hashing;
import com.codeheadsystems.tessera.model.webauthn.WebAuthnCompleteRequest;
import com.codeheadsystems.tessera.model.webauthn.WebAuthnCompleteResponse;
import com.codeheadsystems.tessera.model.webauthn.WebAuthnStartRequest;
import com.codeheadsystems.tessera.model.webauthn.WebAuthnStartResponse;
import com.codeheadsystems.tessera.server.audit.AuditEventType;
import com.codeheadsystems.tessera.server.audit.AuditLogEntry;
import com.codeheadsystems.tessera.server.audit.AuditSink;
import com.codeheadsystems.tessera.server.auth.AuthMethod;
import com.codeheadsystems.tessera.server.auth.JwtManager;
import com.codeheadsystems.tessera.server.error.AuthFailure;
import com.codeheadsystems.tessera.server.error.ErrorCode;
import com.codeheadsystems.tessera.server.error.Outcome;
import com.codeheadsystems.tessera.server.otp.ClientMeta;
import com.codeheadsystems.tessera.server.ratelimit.RateLimitScope;
import com.codeheadsystems.tessera.server.ratelimit.RateLimiter;
import com.codeheadsystems.tessera.server.webauthn.AuthenticationChallenge;
import com.codeheadsystems.tessera.server.webauthn.AuthenticatorAssertion;
import com.codeheadsystems.tessera.server.webauthn.SecondFactorCloneDetector;
import com.codeheadsystems.tessera.server.webauthn.WebAuthnAuthentication;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service behind {@code POST /webauthn/start} and
 * {@code POST /webauthn/complete}.
 * <p>
 * When a cloned authenticator is detected every session token of its owner is revoked, so a
 * token obtained with the clone stops working immediately.
 */
public class WebAuthnManager {

  private static final Logger log = LoggerFactory.getLogger(WebAuthnManager.class);

  private final SecondFactorCloneDetector cloneDetector;
  private final RateLimiter rateLimiter;
  private final JwtManager jwtManager;
  private final AuditSink auditSink;

  public WebAuthnManager(SecondFactorCloneDetector cloneDetector,
                         RateLimiter rateLimiter,
                         JwtManager jwtManager,
                         AuditSink auditSink) {
    this.cloneDetector = cloneDetector;
    this.rateLimiter = rateLimiter;
    this.jwtManager = jwtManager;
    this.auditSink = auditSink;
  }

  /**
   * Issues a challenge, rate-limited per address.
   *
   * @param request    the request
   * @param clientMeta request context
   * @return the challenge options, or a {@code VALIDATION} / {@code RATE_LIMITED} failure
   */
  public Outcome<WebAuthnStartResponse> start(WebAuthnStartRequest request, ClientMeta clientMeta) {
    if (request == null) {
      return Outcome.failure(AuthFailure.validation("Missing request body"));
    }
    String identifier;
    try {
      identifier = request.requireIdentifier();
    } catch (IllegalArgumentException e) {
      return Outcome.failure(AuthFailure.validation(e.getMessage()));
    }
    String address = clientMeta == null || clientMeta.ipAddress() == null ? "unknown" : clientMeta.ipAddress();
    Optional<AuthFailure> limited = rateLimiter.enforce(RateLimitScope.WEBAUTHN_START_IP, address);
    if (limited.isPresent()) {
      return Outcome.failure(limited.get());
    }
    AuthenticationChallenge challenge = cloneDetector.startAuthentication(identifier);
    return Outcome.success(new WebAuthnStartResponse(challenge.challenge(), challenge.allowCredentials(),
        challenge.rpId(), challenge.timeoutMs()));
  }

  /**
   * Completes an authentication and issues a session token.
   *
   * @param request the assertion
   * @return the token, or the failure
   */
  public Outcome<WebAuthnCompleteResponse> complete(WebAuthnCompleteRequest request) {
    if (request == null) {
      return Outcome.failure(AuthFailure.validation("Missing request body"));
    }
    String identifier;
    AuthenticatorAssertion assertion;
    try {
      identifier = request.requireIdentifier();
      assertion = new AuthenticatorAssertion(
          request.requireCredentialId(),
          request.clientDataJsonBytes(),
          request.authenticatorDataBytes(),
          request.signatureBytes(),
          request.userHandleBytes());
    } catch (IllegalArgumentException e) {
      return Outcome.failure(AuthFailure.validation(e.getMessage()));
    }

    Outcome<WebAuthnAuthentication> outcome = cloneDetector.completeAuthentication(identifier, assertion);
    if (!outcome.isSuccess()) {
      if (outcome.failure().code() == ErrorCode.CLONE_DETECTED) {
        revokeSessions(Hashing.sha256Hex(identifier));
      }
      return Outcome.failure(outcome.failure());
    }
    WebAuthnAuthentication authentication = outcome.value();
    String token = jwtManager.issueToken(authentication.ownerHash(), AuthMethod.WEBAUTHN);
    return Outcome.success(new WebAuthnCompleteResponse(true, token));
  }

  private void revokeSessions(String ownerHash) {
    int revoked = jwtManager.revokeSubject(ownerHash);
    log.warn("Revoked {} session(s) after clone detection", revoked);
    auditSink.record(new AuditLogEntry(AuditEventType.SESSIONS_REVOKED, ownerHash,
        rateLimiter.clock().instant(), Map.of("count", String.valueOf(revoked), "reason", "CLONE_DETECTED")));
  }
}
