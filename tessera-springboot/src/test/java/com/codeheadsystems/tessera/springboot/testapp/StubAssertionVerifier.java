package com.codeheadsystems.tessera.springboot.testapp;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.codeheadsystems.tessera.server.webauthn.AssertionVerifier;
import com.codeheadsystems.tessera.server.webauthn.AuthenticatorAssertion;
import com.codeheadsystems.tessera.server.webauthn.PendingChallenge;
import com.codeheadsystems.tessera.server.webauthn.VerifiedAssertion;
import com.codeheadsystems.tessera.server.webauthn.WebAuthnCredential;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;

/**
 * Test verifier: the client data must be the pending challenge and the signature must equal the
 * stored public key. The counter is read from bytes 33-36 of the authenticator data.
 */
public class StubAssertionVerifier implements AssertionVerifier {

  public static byte[] authenticatorData(long counter) {
    return ByteBuffer.allocate(37).put(new byte[32]).put((byte) 0x01).putInt((int) counter).array();
  }

  @Override
  public Optional<VerifiedAssertion> verify(AuthenticatorAssertion assertion,
                                            WebAuthnCredential credential,
                                            PendingChallenge challenge,
                                            String rpId,
                                            String origin) {
    if (!Arrays.equals(credential.publicKey(), assertion.signature())
        || !challenge.challenge().equals(new String(assertion.clientDataJson(), UTF_8))
        || assertion.authenticatorData().length < 37) {
      return Optional.empty();
    }
    long counter = Integer.toUnsignedLong(ByteBuffer.wrap(assertion.authenticatorData(), 33, 4).getInt());
    return Optional.of(new VerifiedAssertion(counter));
  }
}
