package com.codeheadsystems.tessera.server.webauthn;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Non-persistent {@link WebAuthnCredentialRepository}. Counter updates run inside
 * {@link ConcurrentHashMap#compute}. Suitable for development and testing only.
 */
public class InMemoryWebAuthnCredentialRepository implements WebAuthnCredentialRepository {

  private final ConcurrentHashMap<String, WebAuthnCredential> credentials = new ConcurrentHashMap<>();

  @Override
  public void register(WebAuthnCredential credential) {
    if (credentials.putIfAbsent(credential.credentialId(), credential) != null) {
      throw new IllegalArgumentException("Credential already registered");
    }
  }

  @Override
  public Optional<WebAuthnCredential> find(String credentialId) {
    return Optional.ofNullable(credentials.get(credentialId));
  }

  @Override
  public List<WebAuthnCredential> findActiveByOwner(String ownerHash) {
    return credentials.values().stream()
        .filter(c -> c.active() && c.ownerHash().equals(ownerHash))
        .toList();
  }

  @Override
  public CounterUpdate advanceCounter(String credentialId, long newCounter, Instant now) {
    AtomicReference<CounterUpdate> result =
        new AtomicReference<>(new CounterUpdate(CounterUpdate.Status.NOT_FOUND, 0));
    credentials.computeIfPresent(credentialId, (id, current) -> {
      if (!current.active()) {
        result.set(new CounterUpdate(CounterUpdate.Status.INACTIVE, current.counter()));
        return current;
      }
      if (newCounter <= current.counter()) {
        result.set(new CounterUpdate(CounterUpdate.Status.CLONE_DETECTED, current.counter()));
        return current.deactivate();
      }
      result.set(new CounterUpdate(CounterUpdate.Status.ADVANCED, current.counter()));
      return current.withCounter(newCounter, now);
    });
    return result.get();
  }
}
