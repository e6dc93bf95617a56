package com.codeheadsystems.tessera.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tessera.crypto.common.Hashing;
import com.codeheadsystems.tessera.model.ErrorResponse;
import com.codeheadsystems.tessera.model.otp.InitiateRequest;
import com.codeheadsystems.tessera.model.otp.InitiateResponse;
import com.codeheadsystems.tessera.model.otp.VerifyRequest;
import com.codeheadsystems.tessera.model.otp.VerifyResponse;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Dropwizard integration tests for the one-time-code endpoints of {@link TesseraBundle}.
 * <p>
 * Starts a real embedded Jetty server in development mode, so initiate responses carry the code.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class OtpIntegrationTest {

  static final DropwizardAppExtension<TesseraConfiguration> APP =
      new DropwizardAppExtension<>(
          TesseraApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static String uniqueIdentifier() {
    return UUID.randomUUID() + "@example.com";
  }

  // ── Happy path ───────────────────────────────────────────────────────────

  @Test
  void initiateThenVerify_issuesWorkingToken() {
    String identifier = uniqueIdentifier();
    InitiateResponse initiated = initiate(identifier).readEntity(InitiateResponse.class);

    assertThat(initiated.sessionId()).isNotEmpty();
    assertThat(initiated.expiresInSeconds()).isEqualTo(300);
    assertThat(initiated.code()).matches("\\d{6}");

    Response verifyResp = verify(initiated.sessionId(), initiated.code());
    assertThat(verifyResp.getStatus()).isEqualTo(200);
    VerifyResponse verified = verifyResp.readEntity(VerifyResponse.class);
    assertThat(verified.success()).isTrue();
    assertThat(verified.sessionToken()).isNotEmpty();

    Response whoAmI = APP.client()
        .target(baseUrl() + "/api/whoami")
        .request(MediaType.APPLICATION_JSON)
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + verified.sessionToken())
        .get();
    assertThat(whoAmI.getStatus()).isEqualTo(200);
    @SuppressWarnings("unchecked")
    Map<String, String> body = whoAmI.readEntity(Map.class);
    assertThat(body).containsEntry("subject", Hashing.sha256Hex(identifier)).containsEntry("method", "OTP");
  }

  // ── Failures ─────────────────────────────────────────────────────────────

  @Test
  void reusedSession_returns409() {
    InitiateResponse initiated = initiate(uniqueIdentifier()).readEntity(InitiateResponse.class);
    assertThat(verify(initiated.sessionId(), initiated.code()).getStatus()).isEqualTo(200);

    Response reused = verify(initiated.sessionId(), initiated.code());

    assertThat(reused.getStatus()).isEqualTo(409);
    assertThat(reused.readEntity(ErrorResponse.class).error()).isEqualTo("ALREADY_USED");
  }

  @Test
  void wrongCodes_exhaustAttempts() {
    InitiateResponse initiated = initiate(uniqueIdentifier()).readEntity(InitiateResponse.class);
    String wrong = initiated.code().equals("000000") ? "111111" : "000000";

    VerifyResponse first = verify(initiated.sessionId(), wrong).readEntity(VerifyResponse.class);
    assertThat(first.success()).isFalse();
    assertThat(first.attemptsRemaining()).isEqualTo(2);
    verify(initiated.sessionId(), wrong);
    verify(initiated.sessionId(), wrong);

    Response exhausted = verify(initiated.sessionId(), initiated.code());
    assertThat(exhausted.getStatus()).isEqualTo(429);
    ErrorResponse error = exhausted.readEntity(ErrorResponse.class);
    assertThat(error.error()).isEqualTo("ATTEMPTS_EXCEEDED");
    assertThat(error.attemptsRemaining()).isZero();
  }

  @Test
  void identifierRateLimit_returns429WithRetryAfter() {
    String identifier = uniqueIdentifier();
    for (int i = 0; i < 3; i++) {
      assertThat(initiate(identifier).getStatus()).isEqualTo(200);
    }

    Response limited = initiate(identifier);

    assertThat(limited.getStatus()).isEqualTo(429);
    assertThat(Long.parseLong(limited.getHeaderString(HttpHeaders.RETRY_AFTER))).isBetween(1L, 3600L);
    ErrorResponse error = limited.readEntity(ErrorResponse.class);
    assertThat(error.error()).isEqualTo("RATE_LIMITED");
    assertThat(error.retryAfterSeconds()).isBetween(1L, 3600L);
  }

  @Test
  void missingIdentifier_returns400() {
    Response response = initiate("   ");

    assertThat(response.getStatus()).isEqualTo(400);
    assertThat(response.readEntity(ErrorResponse.class).message()).isEqualTo("Missing required field: identifier");
  }

  @Test
  void malformedCode_returns400() {
    InitiateResponse initiated = initiate(uniqueIdentifier()).readEntity(InitiateResponse.class);

    assertThat(verify(initiated.sessionId(), "12345").getStatus()).isEqualTo(400);
  }

  @Test
  void unknownSession_returns404() {
    Response response = verify("no-such-session", "123456");

    assertThat(response.getStatus()).isEqualTo(404);
    assertThat(response.readEntity(ErrorResponse.class).error()).isEqualTo("NOT_FOUND");
  }

  @Test
  void protectedEndpoint_noToken_returns401() {
    Response response = APP.client()
        .target(baseUrl() + "/api/whoami")
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(401);
  }

  // ── Health check ─────────────────────────────────────────────────────────

  @Test
  void healthCheckReportsHealthy() {
    Response response = APP.client()
        .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    String body = response.readEntity(String.class);
    assertThat(body).contains("credential-cipher");
    assertThat(body).contains("argon2id");
  }

  // ── Helper ───────────────────────────────────────────────────────────────

  private Response initiate(String identifier) {
    return APP.client()
        .target(baseUrl() + "/otp/initiate")
        .request(MediaType.APPLICATION_JSON)
        .post(Entity.json(new InitiateRequest(identifier)));
  }

  private Response verify(String sessionId, String code) {
    return APP.client()
        .target(baseUrl() + "/otp/verify")
        .request(MediaType.APPLICATION_JSON)
        .post(Entity.json(new VerifyRequest(sessionId, code)));
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
