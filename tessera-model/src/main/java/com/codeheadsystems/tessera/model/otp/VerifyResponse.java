package com.codeheadsystems.tessera.model.otp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to {@code POST /otp/verify}. A wrong code is not an error: the response carries
 * {@code success=false} and the attempts left. {@code sessionToken} is only present on success.
 *
 * @param success           whether the code matched
 * @param attemptsRemaining attempts left on the session
 * @param sessionToken      bearer token for authenticated endpoints
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerifyResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("attemptsRemaining") int attemptsRemaining,
    @JsonProperty("sessionToken") String sessionToken) {
}
