package com.codeheadsystems.tessera.server.webauthn;

/**
 * A successful second-factor authentication.
 *
 * @param ownerHash    SHA-256 hex of the user's identifier
 * @param credentialId the credential used
 * @param counter      the newly stored counter
 */
public record WebAuthnAuthentication(String ownerHash, String credentialId, long counter) {
}
