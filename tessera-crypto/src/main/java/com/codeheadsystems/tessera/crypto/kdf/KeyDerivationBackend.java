package com.codeheadsystems.tessera.crypto.kdf;

/**
 * A password-based key derivation implementation. Implementations hold no mutable state and
 * are safe for concurrent use.
 */
public interface KeyDerivationBackend {

  /**
   * The algorithm this backend implements.
   *
   * @return the algorithm
   */
  KdfAlgorithm algorithm();

  /**
   * Derives {@code outputLength} bytes from the passphrase and salt.
   *
   * @param passphrase   the passphrase bytes
   * @param salt         the salt
   * @param parameters   cost parameters; their algorithm must match {@link #algorithm()}
   * @param outputLength number of bytes to derive
   * @return the derived bytes
   */
  byte[] derive(byte[] passphrase, byte[] salt, KdfParameters parameters, int outputLength);
}
