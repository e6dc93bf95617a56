package com.codeheadsystems.tessera.crypto.kdf;

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * Argon2id (version 1.3) via the BouncyCastle lightweight API.
 */
public class Argon2idBackend implements KeyDerivationBackend {

  @Override
  public KdfAlgorithm algorithm() {
    return KdfAlgorithm.ARGON2ID;
  }

  @Override
  public byte[] derive(byte[] passphrase, byte[] salt, KdfParameters parameters, int outputLength) {
    if (parameters.algorithm() != KdfAlgorithm.ARGON2ID) {
      throw new IllegalArgumentException("Argon2id backend cannot derive with " + parameters.algorithm());
    }
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    Argon2Parameters params =
        new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
            .withVersion(Argon2Parameters.ARGON2_VERSION_13)
            .withSalt(salt)
            .withMemoryPowOfTwo(parameters.memoryExponent())
            .withIterations(parameters.timeCost())
            .withParallelism(parameters.parallelism())
            .build();
    gen.init(params);
    byte[] output = new byte[outputLength];
    gen.generateBytes(passphrase, output, 0, output.length);
    return output;
  }
}
