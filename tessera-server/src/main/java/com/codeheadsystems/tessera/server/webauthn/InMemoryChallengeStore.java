package com.codeheadsystems.tessera.server.webauthn;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-persistent {@link ChallengeStore}. Suitable for development and testing only.
 */
public class InMemoryChallengeStore implements ChallengeStore {

  private final ConcurrentHashMap<String, PendingChallenge> challenges = new ConcurrentHashMap<>();

  @Override
  public void save(PendingChallenge challenge) {
    challenges.put(challenge.ownerHash(), challenge);
  }

  @Override
  public Optional<PendingChallenge> consume(String ownerHash) {
    return Optional.ofNullable(challenges.remove(ownerHash));
  }

  @Override
  public int purgeExpired(Instant now) {
    AtomicInteger removed = new AtomicInteger();
    challenges.forEach((owner, challenge) -> {
      if (challenge.isExpired(now) && challenges.remove(owner, challenge)) {
        removed.incrementAndGet();
      }
    });
    return removed.get();
  }

  public int size() {
    return challenges.size();
  }
}
