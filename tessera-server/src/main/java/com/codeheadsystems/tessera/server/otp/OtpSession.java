package com.codeheadsystems.tessera.server.otp;

import java.time.Instant;

/**
 * Stored state of one OTP login. Neither the identifier nor the code is stored in clear.
 *
 * @param sessionId        opaque url-safe id, 128 random bits
 * @param hashedIdentifier SHA-256 hex of the destination identifier
 * @param otpHash          SHA-256 hex of {@code code ∥ saltHex ∥ pepper}
 * @param salt             per-session salt, 32 bytes as hex
 * @param createdAt        creation time
 * @param expiresAt        expiry, after {@code createdAt}
 * @param attempts         verification attempts made
 * @param used             true once verified; terminal
 * @param usedAt           time of successful verification, null until then
 * @param clientMeta       request context
 */
public record OtpSession(
    String sessionId,
    String hashedIdentifier,
    String otpHash,
    String salt,
    Instant createdAt,
    Instant expiresAt,
    int attempts,
    boolean used,
    Instant usedAt,
    ClientMeta clientMeta) {

  public OtpSession {
    if (!expiresAt.isAfter(createdAt)) {
      throw new IllegalArgumentException("expiresAt must be after createdAt");
    }
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must not be negative");
    }
    clientMeta = clientMeta == null ? ClientMeta.EMPTY : clientMeta;
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }

  public OtpSession withAttempt() {
    return new OtpSession(sessionId, hashedIdentifier, otpHash, salt, createdAt, expiresAt,
        attempts + 1, used, usedAt, clientMeta);
  }

  public OtpSession markUsed(Instant now) {
    return new OtpSession(sessionId, hashedIdentifier, otpHash, salt, createdAt, expiresAt,
        attempts, true, now, clientMeta);
  }
}
