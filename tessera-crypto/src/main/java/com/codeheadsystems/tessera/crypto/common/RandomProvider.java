package com.codeheadsystems.tessera.crypto.common;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random generation.
 * Used for salts, IVs, session identifiers, WebAuthn challenges and one-time codes.
 */
public record RandomProvider(SecureRandom random) {

  private static final Base64.Encoder URL_SAFE = Base64.getUrlEncoder().withoutPadding();

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Returns a uniformly distributed integer in {@code [origin, bound)}.
   *
   * @param origin inclusive lower bound
   * @param bound  exclusive upper bound
   * @return the random integer
   */
  public int randomInt(int origin, int bound) {
    if (origin >= bound) {
      throw new IllegalArgumentException("origin must be less than bound");
    }
    return origin + random.nextInt(bound - origin);
  }

  /**
   * Generates {@code len} random bytes rendered as unpadded URL-safe base64.
   *
   * @param len the number of random bytes
   * @return the encoded token
   */
  public String urlSafeToken(int len) {
    return URL_SAFE.encodeToString(randomBytes(len));
  }
}
