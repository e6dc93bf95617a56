package com.codeheadsystems.tessera.model.webauthn;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Requests a WebAuthn authentication challenge for a user.
 * <p>
 * Used by: {@code POST /webauthn/start}
 *
 * @param identifier the user's identifier
 */
public record WebAuthnStartRequest(@JsonProperty("identifier") String identifier) {

  public String requireIdentifier() {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Missing required field: identifier");
    }
    return identifier.trim();
  }
}
