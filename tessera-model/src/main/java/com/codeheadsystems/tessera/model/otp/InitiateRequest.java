package com.codeheadsystems.tessera.model.otp;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Starts a one-time-code login for a destination identifier (email address, Nostr public key or
 * phone number). The server never stores the identifier itself, only its SHA-256 hash.
 * <p>
 * Used by: {@code POST /otp/initiate}
 *
 * @param identifier the destination the code is delivered to
 */
public record InitiateRequest(@JsonProperty("identifier") String identifier) {

  public static final int MAX_IDENTIFIER_LENGTH = 320;

  /**
   * The trimmed identifier.
   *
   * @return the identifier
   * @throws IllegalArgumentException if it is missing, blank or longer than 320 characters
   */
  public String requireIdentifier() {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Missing required field: identifier");
    }
    String trimmed = identifier.trim();
    if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
      throw new IllegalArgumentException("Field too long: identifier");
    }
    return trimmed;
  }
}
