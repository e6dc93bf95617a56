package com.codeheadsystems.tessera.server.webauthn;

/**
 * An assertion as received from the client, not yet verified.
 *
 * @param credentialId      base64url credential id
 * @param clientDataJson    raw {@code clientDataJSON}
 * @param authenticatorData raw authenticator data
 * @param signature         raw signature
 * @param userHandle        raw user handle, empty when absent
 */
public record AuthenticatorAssertion(
    String credentialId,
    byte[] clientDataJson,
    byte[] authenticatorData,
    byte[] signature,
    byte[] userHandle) {
}
