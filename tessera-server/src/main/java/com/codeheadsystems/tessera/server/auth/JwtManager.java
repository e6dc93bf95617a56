package com.codeheadsystems.tessera.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.tessera.server.store.SessionData;
import com.codeheadsystems.tessera.server.store.SessionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies session tokens after a successful OTP verification or WebAuthn
 * authentication.
 * <p>
 * Tokens are HMAC-SHA256 JWTs whose subject is the hashed identifier. Each token's JTI is kept in
 * a {@link SessionStore} so that sessions can be revoked before expiry.
 */
public class JwtManager {

  private static final Logger log = LoggerFactory.getLogger(JwtManager.class);

  static final String METHOD_CLAIM = "amr";
  private static final int MIN_SECRET_LENGTH = 32;

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final SessionStore sessionStore;
  private final String issuer;
  private final long ttlSeconds;
  private final Clock clock;

  /**
   * Creates a new JwtManager.
   *
   * @param secret       HMAC-SHA256 signing secret, at least 32 bytes
   * @param issuer       JWT issuer claim
   * @param ttlSeconds   token time-to-live in seconds
   * @param sessionStore backing store for session data and revocation
   */
  public JwtManager(byte[] secret, String issuer, long ttlSeconds, SessionStore sessionStore) {
    this(secret, issuer, ttlSeconds, sessionStore, Clock.systemUTC());
  }

  public JwtManager(byte[] secret, String issuer, long ttlSeconds, SessionStore sessionStore, Clock clock) {
    if (secret == null || secret.length < MIN_SECRET_LENGTH) {
      throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_LENGTH + " bytes");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.sessionStore = sessionStore;
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
    this.clock = clock;
  }

  /**
   * Issues a JWT for an authenticated subject.
   *
   * @param subject hashed identifier
   * @param method  how the subject authenticated
   * @return signed JWT string
   */
  public String issueToken(String subject, AuthMethod method) {
    String jti = UUID.randomUUID().toString();
    Instant now = clock.instant();
    Instant expiresAt = now.plusSeconds(ttlSeconds);

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(subject)
        .withClaim(METHOD_CLAIM, method.name())
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    sessionStore.store(jti, new SessionData(subject, method, now, expiresAt));
    log.debug("Issued JWT jti={} method={}", jti, method);
    return token;
  }

  /**
   * Result of a successful JWT verification.
   *
   * @param subject the JWT subject (hashed identifier)
   * @param jti     the JWT ID
   * @param method  how the subject authenticated
   */
  public record VerifyResult(String subject, String jti, AuthMethod method) {
  }

  /**
   * Verifies a JWT and returns the subject and JTI if valid and not revoked.
   *
   * @param token JWT string
   * @return verify result if valid, empty if invalid or revoked
   */
  public Optional<VerifyResult> verify(String token) {
    try {
      DecodedJWT decoded = verifier.verify(token);
      String jti = decoded.getId();
      Optional<SessionData> session = sessionStore.load(jti);
      if (session.isEmpty()) {
        log.debug("JWT jti={} not found in session store (revoked or expired)", jti);
        return Optional.empty();
      }
      return Optional.of(new VerifyResult(decoded.getSubject(), jti, session.get().method()));
    } catch (JWTVerificationException e) {
      log.debug("JWT verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public void revoke(String jti) {
    sessionStore.revoke(jti);
  }

  /**
   * Revokes every token issued to a subject.
   *
   * @param subject the hashed identifier
   * @return the number of sessions revoked
   */
  public int revokeSubject(String subject) {
    return sessionStore.revokeBySubject(subject);
  }
}
