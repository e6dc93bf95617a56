package com.codeheadsystems.tessera.server.error;

import java.time.Duration;

/**
 * A non-exceptional failure of an authentication step.
 *
 * @param code              the error code
 * @param message           client-facing message, never contains identifiers or codes
 * @param retryAfter        for {@link ErrorCode#RATE_LIMITED}, time until the window resets
 * @param attemptsRemaining for OTP failures, attempts left on the session
 */
public record AuthFailure(ErrorCode code, String message, Duration retryAfter, Integer attemptsRemaining) {

  public static AuthFailure of(ErrorCode code) {
    return new AuthFailure(code, code.message(), null, null);
  }

  /**
   * A validation failure with a specific message, for example
   * {@code "Missing required field: identifier"}.
   *
   * @param message the message
   * @return the failure
   */
  public static AuthFailure validation(String message) {
    return new AuthFailure(ErrorCode.VALIDATION, message, null, null);
  }

  public static AuthFailure rateLimited(Duration retryAfter) {
    return new AuthFailure(ErrorCode.RATE_LIMITED, ErrorCode.RATE_LIMITED.message(), retryAfter, null);
  }

  /**
   * Seconds until retry, rounded up, at least one.
   *
   * @return seconds, or null if not rate limited
   */
  public Long retryAfterSeconds() {
    if (retryAfter == null) {
      return null;
    }
    long millis = Math.max(0, retryAfter.toMillis());
    return Math.max(1, (millis + 999) / 1000);
  }
}
