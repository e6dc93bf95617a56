package com.codeheadsystems.tessera.server.resource;

import com.codeheadsystems.tessera.model.ErrorResponse;
import com.codeheadsystems.tessera.server.error.AuthFailure;
import com.codeheadsystems.tessera.server.error.Outcome;
import com.codeheadsystems.tessera.server.otp.ClientMeta;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Maps {@link Outcome} failures onto JAX-RS responses with an {@link ErrorResponse} body.
 */
final class OutcomeResponses {

  private OutcomeResponses() {
  }

  /**
   * Returns the success value or throws the failure as an {@link AuthFailureException}.
   *
   * @param outcome the outcome
   * @param <T>     the value type
   * @return the value
   */
  static <T> T unwrap(Outcome<T> outcome) {
    if (outcome.isSuccess()) {
      return outcome.value();
    }
    AuthFailure failure = outcome.failure();
    Response.ResponseBuilder builder = Response.status(failure.code().httpStatus())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(failure.code().name(), failure.message(),
            failure.retryAfterSeconds(), failure.attemptsRemaining()));
    if (failure.retryAfterSeconds() != null) {
      builder.header(HttpHeaders.RETRY_AFTER, failure.retryAfterSeconds());
    }
    throw new AuthFailureException(failure, builder.build());
  }

  static ClientMeta clientMeta(HttpServletRequest request) {
    if (request == null) {
      return ClientMeta.EMPTY;
    }
    return ClientMeta.of(request.getHeader("User-Agent"), request.getRemoteAddr());
  }
}
