package com.codeheadsystems.tessera.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tessera.model.ErrorResponse;
import com.codeheadsystems.tessera.model.otp.InitiateRequest;
import com.codeheadsystems.tessera.model.otp.InitiateResponse;
import com.codeheadsystems.tessera.model.otp.VerifyRequest;
import com.codeheadsystems.tessera.model.otp.VerifyResponse;
import com.codeheadsystems.tessera.server.error.AuthFailure;
import com.codeheadsystems.tessera.server.error.ErrorCode;
import com.codeheadsystems.tessera.server.error.Outcome;
import com.codeheadsystems.tessera.server.manager.OtpManager;
import com.codeheadsystems.tessera.server.otp.ClientMeta;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.RuntimeDelegate;
import java.time.Duration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OtpResourceTest {

  private static Response.ResponseBuilder mockBuilder;
  private static Response mockResponse;

  @Mock private OtpManager otpManager;
  @Mock private HttpServletRequest http;
  private OtpResource resource;

  @BeforeAll
  static void installRuntimeDelegate() {
    // Only the API jar is on the test classpath; a mock delegate lets the resource build
    // error responses so the status and headers can be checked on the builder.
    RuntimeDelegate mockRd = mock(RuntimeDelegate.class);
    mockBuilder = mock(Response.ResponseBuilder.class, Mockito.RETURNS_SELF);
    mockResponse = mock(Response.class);

    when(mockRd.createResponseBuilder()).thenReturn(mockBuilder);
    when(mockBuilder.build()).thenReturn(mockResponse);

    RuntimeDelegate.setInstance(mockRd);
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    RuntimeDelegate.setInstance(null);
  }

  @BeforeEach
  void setUp() {
    clearInvocations(mockBuilder);
    resource = new OtpResource(otpManager);
  }

  @Test
  void initiate_success_returnsBodyAndPassesClientMeta() {
    InitiateRequest request = new InitiateRequest("alice@example.com");
    InitiateResponse expected = new InitiateResponse("session-1", 300, null);
    when(http.getHeader("User-Agent")).thenReturn("JUnit");
    when(http.getRemoteAddr()).thenReturn("203.0.113.7");
    when(otpManager.initiate(request, ClientMeta.of("JUnit", "203.0.113.7"))).thenReturn(Outcome.success(expected));

    assertThat(resource.initiate(request, http)).isEqualTo(expected);
    verify(mockBuilder, never()).build();
  }

  @Test
  void initiate_rateLimited_throws429WithRetryAfter() {
    when(otpManager.initiate(any(), any()))
        .thenReturn(Outcome.failure(AuthFailure.rateLimited(Duration.ofSeconds(2399).plusMillis(10))));

    assertThatThrownBy(() -> resource.initiate(new InitiateRequest("alice@example.com"), null))
        .isInstanceOf(AuthFailureException.class)
        .satisfies(e -> {
          assertThat(((WebApplicationException) e).getResponse()).isSameAs(mockResponse);
          assertThat(((AuthFailureException) e).failure().code()).isEqualTo(ErrorCode.RATE_LIMITED);
        })
        .hasMessage("Too many requests");

    verify(mockBuilder).status(429);
    verify(mockBuilder).header(HttpHeaders.RETRY_AFTER, 2400L);
    ArgumentCaptor<Object> entity = ArgumentCaptor.forClass(Object.class);
    verify(mockBuilder).entity(entity.capture());
    assertThat(entity.getValue()).isEqualTo(new ErrorResponse("RATE_LIMITED", "Too many requests", 2400L, null));
  }

  @Test
  void verify_success_returnsToken() {
    VerifyRequest request = new VerifyRequest("session-1", "123456");
    VerifyResponse expected = new VerifyResponse(true, 2, "token");
    when(otpManager.verify(request, ClientMeta.EMPTY)).thenReturn(Outcome.success(expected));

    assertThat(resource.verify(request, null)).isEqualTo(expected);
  }

  @Test
  void verify_alreadyUsed_throws409WithoutRetryAfter() {
    when(otpManager.verify(any(), any())).thenReturn(Outcome.failure(ErrorCode.ALREADY_USED));

    assertThatThrownBy(() -> resource.verify(new VerifyRequest("session-1", "123456"), null))
        .isInstanceOf(WebApplicationException.class);

    verify(mockBuilder).status(409);
    verify(mockBuilder, never()).header(anyString(), any());
  }

  @Test
  void verify_attemptsExceeded_reportsZeroRemaining() {
    when(otpManager.verify(any(), any())).thenReturn(Outcome.failure(
        new AuthFailure(ErrorCode.ATTEMPTS_EXCEEDED, ErrorCode.ATTEMPTS_EXCEEDED.message(), null, 0)));

    assertThatThrownBy(() -> resource.verify(new VerifyRequest("session-1", "123456"), null))
        .isInstanceOf(WebApplicationException.class);

    verify(mockBuilder).status(429);
    verify(mockBuilder).entity(new ErrorResponse("ATTEMPTS_EXCEEDED", "Too many verification attempts", null, 0));
  }
}
