package com.codeheadsystems.tessera.server.webauthn;

import java.time.Instant;
import java.util.Optional;

/**
 * Pending WebAuthn challenges, at most one per user. Implementations must be thread-safe and
 * {@link #consume} must hand a challenge to at most one caller.
 */
public interface ChallengeStore {

  /**
   * Stores a challenge, replacing any pending one for the same user.
   *
   * @param challenge the challenge
   */
  void save(PendingChallenge challenge);

  /**
   * Removes and returns the user's pending challenge.
   *
   * @param ownerHash the user
   * @return the challenge, possibly expired, or empty
   */
  Optional<PendingChallenge> consume(String ownerHash);

  int purgeExpired(Instant now);
}
