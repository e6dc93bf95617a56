package com.codeheadsystems.tessera.server.otp;

import java.time.Instant;

/**
 * A freshly created OTP session and its plaintext code. The code exists only here, on its way
 * to the dispatcher; it is never persisted.
 *
 * @param sessionId        the session id
 * @param code             the six digit code
 * @param hashedIdentifier SHA-256 hex of the identifier
 * @param expiresAt        session expiry
 */
public record IssuedOtp(String sessionId, String code, String hashedIdentifier, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedOtp[sessionId=" + sessionId + ", code=******, expiresAt=" + expiresAt + "]";
  }
}
