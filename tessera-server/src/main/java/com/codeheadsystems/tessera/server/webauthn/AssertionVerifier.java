package com.codeheadsystems.tessera.server.webauthn;

import java.util.Optional;

/**
 * The FIDO2 verification primitive: checks the assertion signature against the credential's
 * public key and checks that the client data names the expected challenge, origin and RP id.
 * Backed by a WebAuthn library in production; this module never verifies signatures itself.
 */
public interface AssertionVerifier {

  /**
   * Verifies an assertion.
   *
   * @param assertion  the assertion
   * @param credential the stored credential it claims to come from
   * @param challenge  the pending challenge it must answer
   * @param rpId       expected RP id
   * @param origin     expected origin
   * @return the verified assertion, or empty if any check failed
   */
  Optional<VerifiedAssertion> verify(AuthenticatorAssertion assertion,
                                     WebAuthnCredential credential,
                                     PendingChallenge challenge,
                                     String rpId,
                                     String origin);
}
