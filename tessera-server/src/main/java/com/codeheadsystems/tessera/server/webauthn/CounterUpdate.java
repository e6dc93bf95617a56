package com.codeheadsystems.tessera.server.webauthn;

/**
 * Result of {@link WebAuthnCredentialRepository#advanceCounter}.
 *
 * @param status          what happened
 * @param previousCounter the stored counter before the call, 0 when not found
 */
public record CounterUpdate(Status status, long previousCounter) {

  public enum Status {
    /** The counter increased and was stored. */
    ADVANCED,
    /** The counter did not increase; the credential is now inactive. */
    CLONE_DETECTED,
    /** The credential was already inactive; nothing changed. */
    INACTIVE,
    NOT_FOUND
  }
}
