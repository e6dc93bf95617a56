package com.codeheadsystems.tessera.model.webauthn;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;

/**
 * The authenticator's assertion, as produced by {@code navigator.credentials.get()}.
 * <p>
 * All binary fields are base64url (padding optional). The server hands them to the FIDO2
 * verifier untouched; it never parses the signature itself.
 * <p>
 * Used by: {@code POST /webauthn/complete}
 *
 * @param identifier        the user's identifier
 * @param credentialId      base64url credential id
 * @param clientDataJson    base64url {@code clientDataJSON}
 * @param authenticatorData base64url authenticator data, carries the signature counter
 * @param signature         base64url assertion signature
 * @param userHandle        base64url user handle, optional
 */
public record WebAuthnCompleteRequest(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("credentialId") String credentialId,
    @JsonProperty("clientDataJSON") String clientDataJson,
    @JsonProperty("authenticatorData") String authenticatorData,
    @JsonProperty("signature") String signature,
    @JsonProperty("userHandle") String userHandle) {

  private static final Base64.Decoder B64D = Base64.getUrlDecoder();

  private static byte[] decode(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }

  public String requireIdentifier() {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Missing required field: identifier");
    }
    return identifier.trim();
  }

  public String requireCredentialId() {
    decode(credentialId, "credentialId");
    return credentialId;
  }

  public byte[] clientDataJsonBytes() {
    return decode(clientDataJson, "clientDataJSON");
  }

  public byte[] authenticatorDataBytes() {
    return decode(authenticatorData, "authenticatorData");
  }

  public byte[] signatureBytes() {
    return decode(signature, "signature");
  }

  /**
   * The decoded user handle.
   *
   * @return the bytes, or an empty array when absent
   */
  public byte[] userHandleBytes() {
    if (userHandle == null || userHandle.isBlank()) {
      return new byte[0];
    }
    return decode(userHandle, "userHandle");
  }
}
