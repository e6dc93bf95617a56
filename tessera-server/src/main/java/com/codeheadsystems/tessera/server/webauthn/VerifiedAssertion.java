package com.codeheadsystems.tessera.server.webauthn;

/**
 * An assertion whose signature, challenge, origin and RP id have been checked.
 *
 * @param signCount the signature counter parsed from the authenticator data
 */
public record VerifiedAssertion(long signCount) {
}
