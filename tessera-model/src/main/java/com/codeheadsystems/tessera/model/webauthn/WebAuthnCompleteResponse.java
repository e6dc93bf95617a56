package com.codeheadsystems.tessera.model.webauthn;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to a successful {@code POST /webauthn/complete}. Failures use the error body.
 *
 * @param success      always true
 * @param sessionToken bearer token for authenticated endpoints
 */
public record WebAuthnCompleteResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("sessionToken") String sessionToken) {
}
