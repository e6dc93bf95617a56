package com.codeheadsystems.tessera.model.otp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to {@code POST /otp/initiate}.
 * <p>
 * {@code code} is only populated outside production so that local clients can complete the
 * flow without a delivery channel; it is omitted from the JSON when null.
 *
 * @param sessionId        opaque session handle the client echoes in {@link VerifyRequest}
 * @param expiresInSeconds seconds until the code expires
 * @param code             the code itself, development mode only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InitiateResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("expiresInSeconds") long expiresInSeconds,
    @JsonProperty("code") String code) {
}
