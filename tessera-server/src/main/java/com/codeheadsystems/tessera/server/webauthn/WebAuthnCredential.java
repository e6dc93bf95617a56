package com.codeheadsystems.tessera.server.webauthn;

import java.time.Instant;

/**
 * A registered hardware authenticator.
 *
 * @param credentialId base64url credential id
 * @param ownerHash    SHA-256 hex of the owner's identifier
 * @param publicKey    COSE public key, opaque to this module
 * @param counter      last accepted signature counter
 * @param deviceMeta   free-form device description, may be null
 * @param active       false once disabled; never re-enabled
 * @param createdAt    registration time
 * @param lastUsedAt   last successful authentication, null until then
 */
public record WebAuthnCredential(
    String credentialId,
    String ownerHash,
    byte[] publicKey,
    long counter,
    String deviceMeta,
    boolean active,
    Instant createdAt,
    Instant lastUsedAt) {

  public WebAuthnCredential {
    if (counter < 0) {
      throw new IllegalArgumentException("counter must not be negative: " + counter);
    }
  }

  public WebAuthnCredential withCounter(long newCounter, Instant now) {
    return new WebAuthnCredential(credentialId, ownerHash, publicKey, newCounter, deviceMeta, active,
        createdAt, now);
  }

  public WebAuthnCredential deactivate() {
    return new WebAuthnCredential(credentialId, ownerHash, publicKey, counter, deviceMeta, false,
        createdAt, lastUsedAt);
  }
}
