package com.codeheadsystems.tessera.crypto.kdf;

/**
 * Key derivation algorithms, named as they appear in stored hashes and blobs.
 */
public enum KdfAlgorithm {
  ARGON2ID("argon2id"),
  PBKDF2_SHA256("pbkdf2-sha256");

  private final String id;

  KdfAlgorithm(String id) {
    this.id = id;
  }

  /**
   * Looks up an algorithm by its encoded identifier.
   *
   * @param id the identifier
   * @return the algorithm
   * @throws IllegalArgumentException if the identifier is unknown
   */
  public static KdfAlgorithm fromId(String id) {
    for (KdfAlgorithm algorithm : values()) {
      if (algorithm.id.equals(id)) {
        return algorithm;
      }
    }
    throw new IllegalArgumentException("Unknown KDF algorithm: " + id);
  }

  public String id() {
    return id;
  }
}
