package com.codeheadsystems.tessera.crypto.kdf;

import java.util.HashMap;
import java.util.Map;

/**
 * Cost parameters for a key derivation.
 * <p>
 * Argon2id memory is configured as a power-of-two exponent of KiB (16 means 64 MiB).
 * PBKDF2 only uses {@code iterations}; the Argon2id fields are zero for it.
 * <p>
 * The constructor enforces structural validity only. Whether a value is acceptable for a
 * deployment is decided by {@link KdfConfigValidator}.
 *
 * @param algorithm      the algorithm
 * @param memoryExponent Argon2id memory cost as log2(KiB)
 * @param timeCost       Argon2id passes over memory
 * @param parallelism    Argon2id lanes, always 1
 * @param iterations     PBKDF2 iteration count
 */
public record KdfParameters(
    KdfAlgorithm algorithm,
    int memoryExponent,
    int timeCost,
    int parallelism,
    int iterations) {

  public static final int MIN_PBKDF2_ITERATIONS = 100_000;
  public static final int DEFAULT_PBKDF2_ITERATIONS = 310_000;

  /**
   * Production default: 64 MiB, three passes.
   */
  public static final KdfParameters DEFAULT = argon2id(16, 3);

  /**
   * Used when no Argon2id implementation can be loaded.
   */
  public static final KdfParameters PBKDF2_DEFAULT = pbkdf2(DEFAULT_PBKDF2_ITERATIONS);

  public KdfParameters {
    if (algorithm == null) {
      throw new IllegalArgumentException("algorithm is required");
    }
    if (algorithm == KdfAlgorithm.ARGON2ID) {
      if (memoryExponent < 3 || memoryExponent > 30) {
        throw new IllegalArgumentException("Argon2id memory exponent must be within [3,30]: " + memoryExponent);
      }
      if (timeCost < 1) {
        throw new IllegalArgumentException("Argon2id time cost must be positive: " + timeCost);
      }
      if (parallelism != 1) {
        throw new IllegalArgumentException("Argon2id parallelism must be 1: " + parallelism);
      }
    } else if (iterations < MIN_PBKDF2_ITERATIONS) {
      throw new IllegalArgumentException(
          "PBKDF2 requires at least " + MIN_PBKDF2_ITERATIONS + " iterations: " + iterations);
    }
  }

  /**
   * Argon2id parameters with parallelism 1.
   *
   * @param memoryExponent log2 of memory in KiB
   * @param timeCost       passes
   * @return the parameters
   */
  public static KdfParameters argon2id(int memoryExponent, int timeCost) {
    return new KdfParameters(KdfAlgorithm.ARGON2ID, memoryExponent, timeCost, 1, 0);
  }

  /**
   * PBKDF2-HMAC-SHA256 parameters.
   *
   * @param iterations the iteration count
   * @return the parameters
   */
  public static KdfParameters pbkdf2(int iterations) {
    return new KdfParameters(KdfAlgorithm.PBKDF2_SHA256, 0, 0, 0, iterations);
  }

  /**
   * Cheapest parameters that still pass startup validation (4 MiB, two passes).
   *
   * @return the parameters
   */
  public static KdfParameters forTesting() {
    return argon2id(12, 2);
  }

  /**
   * Memory cost in KiB. Zero for PBKDF2.
   *
   * @return the memory in KiB
   */
  public long memoryKib() {
    return algorithm == KdfAlgorithm.ARGON2ID ? 1L << memoryExponent : 0L;
  }

  /**
   * Encodes the parameters the way they appear in PHC strings, for example
   * {@code argon2id$m=65536,t=3,p=1} or {@code pbkdf2-sha256$i=310000}.
   *
   * @return the encoded parameters
   */
  public String encode() {
    if (algorithm == KdfAlgorithm.ARGON2ID) {
      return algorithm.id() + "$m=" + memoryKib() + ",t=" + timeCost + ",p=" + parallelism;
    }
    return algorithm.id() + "$i=" + iterations;
  }

  /**
   * Parses an algorithm identifier and its comma separated parameter list.
   *
   * @param algorithmId the algorithm identifier
   * @param paramList   the parameter list, e.g. {@code m=65536,t=3,p=1}
   * @return the parameters
   * @throws IllegalArgumentException if the list is malformed or the values are invalid
   */
  public static KdfParameters parse(String algorithmId, String paramList) {
    KdfAlgorithm algorithm = KdfAlgorithm.fromId(algorithmId);
    Map<String, Long> values = new HashMap<>();
    for (String pair : paramList.split(",")) {
      int eq = pair.indexOf('=');
      if (eq <= 0 || eq == pair.length() - 1) {
        throw new IllegalArgumentException("Malformed KDF parameter: " + pair);
      }
      try {
        values.put(pair.substring(0, eq), Long.parseLong(pair.substring(eq + 1)));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Malformed KDF parameter: " + pair, e);
      }
    }
    if (algorithm == KdfAlgorithm.ARGON2ID) {
      long memoryKib = required(values, "m");
      if (memoryKib <= 0 || Long.bitCount(memoryKib) != 1) {
        throw new IllegalArgumentException("Argon2id memory must be a power of two KiB: " + memoryKib);
      }
      return new KdfParameters(algorithm, Long.numberOfTrailingZeros(memoryKib),
          Math.toIntExact(required(values, "t")), Math.toIntExact(required(values, "p")), 0);
    }
    return pbkdf2(Math.toIntExact(required(values, "i")));
  }

  private static long required(Map<String, Long> values, String name) {
    Long value = values.get(name);
    if (value == null) {
      throw new IllegalArgumentException("Missing KDF parameter: " + name);
    }
    return value;
  }
}
