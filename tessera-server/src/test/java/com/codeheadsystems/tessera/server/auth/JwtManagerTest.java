package com.codeheadsystems.tessera.server.auth;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.tessera.server.auth.JwtManager.VerifyResult;
import com.codeheadsystems.tessera.server.store.InMemorySessionStore;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtManagerTest {

  private static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes(UTF_8);
  private static final byte[] WRONG_SECRET = "wrong-secret-must-be-at-least-32-bytes".getBytes(UTF_8);
  private static final String SUBJECT = "5d41402abc4b2a76b9719d911017c592";

  private InMemorySessionStore sessionStore;
  private JwtManager jwtManager;

  @BeforeEach
  void setUp() {
    sessionStore = new InMemorySessionStore();
    jwtManager = new JwtManager(SECRET, "test-issuer", 3600, sessionStore);
  }

  @Test
  void issueAndVerify_roundTrip() {
    String token = jwtManager.issueToken(SUBJECT, AuthMethod.OTP);
    Optional<VerifyResult> result = jwtManager.verify(token);
    assertThat(result).isPresent();
    assertThat(result.get().subject()).isEqualTo(SUBJECT);
    assertThat(result.get().method()).isEqualTo(AuthMethod.OTP);
    assertThat(JWT.decode(token).getClaim(JwtManager.METHOD_CLAIM).asString()).isEqualTo("OTP");
  }

  @Test
  void verify_revokedToken_returnsEmpty() {
    String token = jwtManager.issueToken(SUBJECT, AuthMethod.WEBAUTHN);
    jwtManager.revoke(JWT.decode(token).getId());

    assertThat(jwtManager.verify(token)).isEmpty();
  }

  @Test
  void revokeSubject_revokesEveryTokenOfThatSubjectOnly() {
    String first = jwtManager.issueToken(SUBJECT, AuthMethod.OTP);
    String second = jwtManager.issueToken(SUBJECT, AuthMethod.WEBAUTHN);
    String other = jwtManager.issueToken("other-subject", AuthMethod.OTP);

    assertThat(jwtManager.revokeSubject(SUBJECT)).isEqualTo(2);

    assertThat(jwtManager.verify(first)).isEmpty();
    assertThat(jwtManager.verify(second)).isEmpty();
    assertThat(jwtManager.verify(other)).isPresent();
    assertThat(jwtManager.revokeSubject(SUBJECT)).isZero();
  }

  @Test
  void verify_wrongSecret_returnsEmpty() {
    String token = jwtManager.issueToken(SUBJECT, AuthMethod.OTP);

    JwtManager wrongManager = new JwtManager(WRONG_SECRET, "test-issuer", 3600, new InMemorySessionStore());
    assertThat(wrongManager.verify(token)).isEmpty();
  }

  @Test
  void verify_wrongIssuer_returnsEmpty() {
    String token = jwtManager.issueToken(SUBJECT, AuthMethod.OTP);

    JwtManager otherIssuer = new JwtManager(SECRET, "other-issuer", 3600, sessionStore);
    assertThat(otherIssuer.verify(token)).isEmpty();
  }

  @Test
  void verify_expiredToken_returnsEmpty() {
    String token = JWT.create()
        .withIssuer("test-issuer")
        .withJWTId("expired-jti")
        .withSubject(SUBJECT)
        .withIssuedAt(Instant.now().minusSeconds(7200))
        .withExpiresAt(Instant.now().minusSeconds(3600))
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(jwtManager.verify(token)).isEmpty();
  }

  @Test
  void verify_tamperedToken_returnsEmpty() {
    String token = jwtManager.issueToken(SUBJECT, AuthMethod.OTP);
    String tampered = token.substring(0, token.length() - 2) + "XX";
    assertThat(jwtManager.verify(tampered)).isEmpty();
  }

  @Test
  void verify_garbage_returnsEmpty() {
    assertThat(jwtManager.verify("not-a-jwt")).isEmpty();
  }

  @Test
  void constructor_shortSecret_throws() {
    assertThatThrownBy(() -> new JwtManager("too-short".getBytes(UTF_8), "test-issuer", 3600, sessionStore))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("32 bytes");
  }
}
