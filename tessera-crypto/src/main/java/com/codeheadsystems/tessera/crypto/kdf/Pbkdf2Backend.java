package com.codeheadsystems.tessera.crypto.kdf;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * PBKDF2-HMAC-SHA256, used only when Argon2id cannot be loaded.
 */
public class Pbkdf2Backend implements KeyDerivationBackend {

  @Override
  public KdfAlgorithm algorithm() {
    return KdfAlgorithm.PBKDF2_SHA256;
  }

  @Override
  public byte[] derive(byte[] passphrase, byte[] salt, KdfParameters parameters, int outputLength) {
    if (parameters.algorithm() != KdfAlgorithm.PBKDF2_SHA256) {
      throw new IllegalArgumentException("PBKDF2 backend cannot derive with " + parameters.algorithm());
    }
    PKCS5S2ParametersGenerator gen = new PKCS5S2ParametersGenerator(new SHA256Digest());
    gen.init(passphrase, salt, parameters.iterations());
    KeyParameter key = (KeyParameter) gen.generateDerivedParameters(outputLength * 8);
    return key.getKey();
  }
}
