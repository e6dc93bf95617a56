package com.codeheadsystems.tessera.model.webauthn;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Options for {@code navigator.credentials.get()}.
 *
 * @param challenge        base64url challenge, at least 32 random bytes
 * @param allowCredentials base64url ids of the user's active credentials
 * @param rpId             relying party id
 * @param timeoutMs        client-side ceremony timeout
 */
public record WebAuthnStartResponse(
    @JsonProperty("challenge") String challenge,
    @JsonProperty("allowCredentials") List<String> allowCredentials,
    @JsonProperty("rpId") String rpId,
    @JsonProperty("timeoutMs") long timeoutMs) {

  public WebAuthnStartResponse {
    allowCredentials = allowCredentials == null ? List.of() : List.copyOf(allowCredentials);
  }
}
