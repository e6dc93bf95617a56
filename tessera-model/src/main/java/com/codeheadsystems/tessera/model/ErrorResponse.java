package com.codeheadsystems.tessera.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by every endpoint.
 * <p>
 * {@code error} is the stable machine-readable code (for example {@code RATE_LIMITED});
 * {@code message} is a fixed human-readable text that never contains identifiers, codes or
 * internal detail. The optional fields are omitted when they do not apply.
 *
 * @param error             stable error code
 * @param message           stable, non-leaking message
 * @param retryAfterSeconds seconds until a rate-limited caller may retry
 * @param attemptsRemaining verification attempts left on the session
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message,
    @JsonProperty("retryAfterSeconds") Long retryAfterSeconds,
    @JsonProperty("attemptsRemaining") Integer attemptsRemaining) {

  public ErrorResponse(String error, String message) {
    this(error, message, null, null);
  }
}
