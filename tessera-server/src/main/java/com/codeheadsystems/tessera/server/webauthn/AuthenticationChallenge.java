package com.codeheadsystems.tessera.server.webauthn;

import java.util.List;

/**
 * Options returned by {@link SecondFactorCloneDetector#startAuthentication}.
 *
 * @param challenge        base64url challenge
 * @param allowCredentials ids of the user's active credentials
 * @param rpId             relying party id
 * @param timeoutMs        ceremony timeout
 */
public record AuthenticationChallenge(String challenge, List<String> allowCredentials, String rpId,
                                      long timeoutMs) {

  public AuthenticationChallenge {
    allowCredentials = List.copyOf(allowCredentials);
  }
}
