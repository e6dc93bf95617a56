package com.codeheadsystems.tessera.server.webauthn;

import java.time.Instant;

/**
 * A challenge issued to a user and not yet answered.
 *
 * @param ownerHash SHA-256 hex of the user's identifier
 * @param challenge base64url challenge
 * @param createdAt issue time
 * @param expiresAt expiry
 */
public record PendingChallenge(String ownerHash, String challenge, Instant createdAt, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }
}
