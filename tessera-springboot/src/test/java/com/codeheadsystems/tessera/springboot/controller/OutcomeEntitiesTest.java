package com.codeheadsystems.tessera.springboot.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tessera.model.ErrorResponse;
import com.codeheadsystems.tessera.server.error.AuthFailure;
import com.codeheadsystems.tessera.server.error.ErrorCode;
import com.codeheadsystems.tessera.server.error.Outcome;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

class OutcomeEntitiesTest {

  @Test
  void success_returns200WithValue() {
    ResponseEntity<Object> entity = OutcomeEntities.toEntity(Outcome.success("ok"));

    assertThat(entity.getStatusCode().value()).isEqualTo(200);
    assertThat(entity.getBody()).isEqualTo("ok");
  }

  @Test
  void rateLimited_setsRetryAfter() {
    ResponseEntity<Object> entity =
        OutcomeEntities.toEntity(Outcome.failure(AuthFailure.rateLimited(Duration.ofSeconds(42))));

    assertThat(entity.getStatusCode().value()).isEqualTo(429);
    assertThat(entity.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("42");
    assertThat(entity.getBody()).isEqualTo(new ErrorResponse("RATE_LIMITED", "Too many requests", 42L, null));
  }

  @Test
  void alreadyUsed_returns409WithoutRetryAfter() {
    ResponseEntity<Object> entity = OutcomeEntities.toEntity(Outcome.failure(ErrorCode.ALREADY_USED));

    assertThat(entity.getStatusCode().value()).isEqualTo(409);
    assertThat(entity.getHeaders().containsKey(HttpHeaders.RETRY_AFTER)).isFalse();
  }
}
