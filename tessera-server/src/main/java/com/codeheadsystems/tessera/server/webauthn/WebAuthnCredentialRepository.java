package com.codeheadsystems.tessera.server.webauthn;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for WebAuthn credentials. Implementations must be thread-safe.
 */
public interface WebAuthnCredentialRepository {

  /**
   * Stores a new credential.
   *
   * @param credential the credential
   * @throws IllegalArgumentException if the credential id is already registered
   */
  void register(WebAuthnCredential credential);

  Optional<WebAuthnCredential> find(String credentialId);

  List<WebAuthnCredential> findActiveByOwner(String ownerHash);

  /**
   * Compares and updates the counter as one atomic operation: stores {@code newCounter} and
   * {@code now} when it is strictly greater than the stored counter, otherwise deactivates the
   * credential. Two concurrent calls with the same counter therefore yield one
   * {@code ADVANCED} and one {@code CLONE_DETECTED}.
   *
   * @param credentialId the credential
   * @param newCounter   counter reported by the authenticator
   * @param now          the current time
   * @return the update result
   */
  CounterUpdate advanceCounter(String credentialId, long newCounter, Instant now);
}
