package com.codeheadsystems.tessera.model.otp;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.regex.Pattern;

/**
 * Submits a one-time code for a session.
 * <p>
 * Used by: {@code POST /otp/verify}
 *
 * @param sessionId the session returned by {@link InitiateResponse}
 * @param code      the six digit code
 */
public record VerifyRequest(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("code") String code) {

  private static final Pattern CODE = Pattern.compile("\\d{6}");

  public String requireSessionId() {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: sessionId");
    }
    return sessionId.trim();
  }

  /**
   * The code, checked for shape only.
   *
   * @return the code
   * @throws IllegalArgumentException if it is missing or not exactly six digits
   */
  public String requireCode() {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("Missing required field: code");
    }
    String trimmed = code.trim();
    if (!CODE.matcher(trimmed).matches()) {
      throw new IllegalArgumentException("Invalid format in field: code");
    }
    return trimmed;
  }
}
