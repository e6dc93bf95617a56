package com.codeheadsystems.tessera.server.webauthn;

import com.codeheadsystems.tessera.crypto.common.Hashing;
import com.codeheadsystems.tessera.crypto.common.RandomProvider;
import com.codeheadsystems.tessera.server.audit.AuditEventType;
import com.codeheadsystems.tessera.server.audit.AuditLogEntry;
import com.codeheadsystems.tessera.server.audit.AuditSink;
import com.codeheadsystems.tessera.server.error.ErrorCode;
import com.codeheadsystems.tessera.server.error.Outcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebAuthn second factor with signature-counter clone detection.
 * <p>
 * An authenticator's counter must strictly increase with every accepted assertion. A counter
 * that does not increase means two devices hold the same key; the credential is then disabled
 * for good and a {@link AuditEventType#CLONING_DETECTED} event is written.
 * <p>
 * A pending challenge is consumed by every completion attempt, successful or not.
 */
public class SecondFactorCloneDetector {

  private static final Logger log = LoggerFactory.getLogger(SecondFactorCloneDetector.class);

  public static final int CHALLENGE_LENGTH = 32;

  private final WebAuthnCredentialRepository credentials;
  private final ChallengeStore challenges;
  private final AssertionVerifier verifier;
  private final RandomProvider randomProvider;
  private final AuditSink auditSink;
  private final Clock clock;
  private final String rpId;
  private final String origin;
  private final Duration timeout;
  private final Duration challengeTtl;

  /**
   * Instantiates a new Second factor clone detector.
   *
   * @param credentials    credential storage
   * @param challenges     pending challenge storage
   * @param verifier       FIDO2 assertion verifier
   * @param randomProvider source of challenges
   * @param auditSink      audit destination
   * @param clock          time source
   * @param rpId           relying party id
   * @param origin         expected origin
   * @param timeout        client-side ceremony timeout
   * @param challengeTtl   lifetime of a pending challenge
   */
  public SecondFactorCloneDetector(WebAuthnCredentialRepository credentials,
                                   ChallengeStore challenges,
                                   AssertionVerifier verifier,
                                   RandomProvider randomProvider,
                                   AuditSink auditSink,
                                   Clock clock,
                                   String rpId,
                                   String origin,
                                   Duration timeout,
                                   Duration challengeTtl) {
    if (verifier == null) {
      throw new IllegalArgumentException("An AssertionVerifier is required");
    }
    this.credentials = credentials;
    this.challenges = challenges;
    this.verifier = verifier;
    this.randomProvider = randomProvider;
    this.auditSink = auditSink;
    this.clock = clock;
    this.rpId = rpId;
    this.origin = origin;
    this.timeout = timeout;
    this.challengeTtl = challengeTtl;
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Registers a credential for a user.
   *
   * @param identifier     the owner's identifier
   * @param credentialId   base64url credential id
   * @param publicKey      COSE public key
   * @param initialCounter counter reported at registration
   * @param deviceMeta     device description, may be null
   * @return the stored credential
   * @throws IllegalArgumentException if the id is already registered or a value is invalid
   */
  public WebAuthnCredential register(String identifier, String credentialId, byte[] publicKey,
                                     long initialCounter, String deviceMeta) {
    if (identifier == null || identifier.isBlank() || credentialId == null || credentialId.isBlank()) {
      throw new IllegalArgumentException("identifier and credentialId are required");
    }
    if (publicKey == null || publicKey.length == 0) {
      throw new IllegalArgumentException("publicKey is required");
    }
    Instant now = clock.instant();
    String ownerHash = Hashing.sha256Hex(identifier);
    WebAuthnCredential credential = new WebAuthnCredential(credentialId, ownerHash, publicKey.clone(),
        initialCounter, deviceMeta, true, now, null);
    credentials.register(credential);
    audit(AuditEventType.WEBAUTHN_CREDENTIAL_REGISTERED, ownerHash, now, Map.of("credentialId", credentialId));
    return credential;
  }

  // ── Authentication ───────────────────────────────────────────────────────

  /**
   * Issues a challenge and lists the user's active credentials. Any earlier pending challenge
   * for the user is replaced.
   *
   * @param identifier the user's identifier
   * @return the challenge options
   */
  public AuthenticationChallenge startAuthentication(String identifier) {
    Instant now = clock.instant();
    String ownerHash = Hashing.sha256Hex(identifier);
    String challenge = randomProvider.urlSafeToken(CHALLENGE_LENGTH);
    challenges.save(new PendingChallenge(ownerHash, challenge, now, now.plus(challengeTtl)));
    List<String> allow = credentials.findActiveByOwner(ownerHash).stream()
        .map(WebAuthnCredential::credentialId)
        .toList();
    audit(AuditEventType.WEBAUTHN_CHALLENGE_ISSUED, ownerHash, now,
        Map.of("credentials", String.valueOf(allow.size())));
    log.debug("startAuthentication({}) credentials={}", Hashing.forLogging(identifier), allow.size());
    return new AuthenticationChallenge(challenge, allow, rpId, timeout.toMillis());
  }

  /**
   * Verifies an assertion and enforces counter monotonicity.
   *
   * @param identifier the user's identifier
   * @param assertion  the assertion
   * @return the authentication, or {@code CREDENTIAL_NOT_FOUND_OR_INACTIVE},
   *     {@code ASSERTION_INVALID} or {@code CLONE_DETECTED}
   */
  public Outcome<WebAuthnAuthentication> completeAuthentication(String identifier,
                                                                AuthenticatorAssertion assertion) {
    Instant now = clock.instant();
    String ownerHash = Hashing.sha256Hex(identifier);
    Optional<PendingChallenge> pending = challenges.consume(ownerHash);
    String credentialId = assertion.credentialId();
    if (credentialId == null || credentialId.isBlank()) {
      audit(AuditEventType.WEBAUTHN_CREDENTIAL_NOT_FOUND, ownerHash, now, Map.of());
      return Outcome.failure(ErrorCode.CREDENTIAL_NOT_FOUND_OR_INACTIVE);
    }

    Optional<WebAuthnCredential> found = credentials.find(credentialId)
        .filter(c -> c.active() && c.ownerHash().equals(ownerHash));
    if (found.isEmpty()) {
      audit(AuditEventType.WEBAUTHN_CREDENTIAL_NOT_FOUND, ownerHash, now, Map.of("credentialId", credentialId));
      return Outcome.failure(ErrorCode.CREDENTIAL_NOT_FOUND_OR_INACTIVE);
    }
    WebAuthnCredential credential = found.get();

    if (pending.isEmpty() || pending.get().isExpired(now)) {
      audit(AuditEventType.WEBAUTHN_ASSERTION_INVALID, ownerHash, now,
          Map.of("credentialId", credentialId, "reason", "no pending challenge"));
      return Outcome.failure(ErrorCode.ASSERTION_INVALID);
    }
    Optional<VerifiedAssertion> verified = verify(assertion, credential, pending.get());
    if (verified.isEmpty()) {
      audit(AuditEventType.WEBAUTHN_ASSERTION_INVALID, ownerHash, now,
          Map.of("credentialId", credentialId, "reason", "verification failed"));
      return Outcome.failure(ErrorCode.ASSERTION_INVALID);
    }

    long newCounter = verified.get().signCount();
    CounterUpdate update = credentials.advanceCounter(credentialId, newCounter, now);
    switch (update.status()) {
      case ADVANCED -> {
        audit(AuditEventType.WEBAUTHN_AUTHENTICATED, ownerHash, now,
            Map.of("credentialId", credentialId, "counter", String.valueOf(newCounter)));
        return Outcome.success(new WebAuthnAuthentication(ownerHash, credentialId, newCounter));
      }
      case CLONE_DETECTED -> {
        log.error("Cloned authenticator detected for credential {}: counter {} <= stored {}",
            credentialId, newCounter, update.previousCounter());
        audit(AuditEventType.CLONING_DETECTED, ownerHash, now,
            Map.of("credentialId", credentialId,
                "storedCounter", String.valueOf(update.previousCounter()),
                "newCounter", String.valueOf(newCounter)));
        return Outcome.failure(ErrorCode.CLONE_DETECTED);
      }
      default -> {
        // disabled or removed concurrently
        audit(AuditEventType.WEBAUTHN_CREDENTIAL_NOT_FOUND, ownerHash, now, Map.of("credentialId", credentialId));
        return Outcome.failure(ErrorCode.CREDENTIAL_NOT_FOUND_OR_INACTIVE);
      }
    }
  }

  /**
   * Removes expired pending challenges.
   *
   * @return the number removed
   */
  public int purgeExpiredChallenges() {
    return challenges.purgeExpired(clock.instant());
  }

  private Optional<VerifiedAssertion> verify(AuthenticatorAssertion assertion,
                                             WebAuthnCredential credential,
                                             PendingChallenge challenge) {
    try {
      return verifier.verify(assertion, credential, challenge, rpId, origin);
    } catch (RuntimeException e) {
      log.warn("Assertion verifier rejected credential {}: {}", credential.credentialId(), e.toString());
      return Optional.empty();
    }
  }

  private void audit(AuditEventType type, String subjectHash, Instant now, Map<String, String> details) {
    auditSink.record(new AuditLogEntry(type, subjectHash, now, details));
  }
}
