package com.codeheadsystems.tessera.springboot.controller;

import com.codeheadsystems.tessera.model.ErrorResponse;
import com.codeheadsystems.tessera.server.error.AuthFailure;
import com.codeheadsystems.tessera.server.error.Outcome;
import com.codeheadsystems.tessera.server.otp.ClientMeta;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

/**
 * Maps {@link Outcome} values onto Spring MVC responses.
 */
final class OutcomeEntities {

  private OutcomeEntities() {
  }

  static ResponseEntity<Object> toEntity(Outcome<?> outcome) {
    if (outcome.isSuccess()) {
      return ResponseEntity.ok(outcome.value());
    }
    AuthFailure failure = outcome.failure();
    ResponseEntity.BodyBuilder builder = ResponseEntity.status(failure.code().httpStatus());
    if (failure.retryAfterSeconds() != null) {
      builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(failure.retryAfterSeconds()));
    }
    return builder.body(new ErrorResponse(failure.code().name(), failure.message(),
        failure.retryAfterSeconds(), failure.attemptsRemaining()));
  }

  static ClientMeta clientMeta(HttpServletRequest request) {
    return ClientMeta.of(request.getHeader(HttpHeaders.USER_AGENT), request.getRemoteAddr());
  }
}
