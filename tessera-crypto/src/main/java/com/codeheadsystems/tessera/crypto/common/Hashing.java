package com.codeheadsystems.tessera.crypto.common;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

/**
 * Privacy hashing helpers. Identifiers, IP addresses and one-time codes are only
 * ever stored, logged or used as map keys in one of these hashed forms.
 */
public class Hashing {

  /**
   * Salt for rate-limit keys. Keys keep the first 32 hex characters.
   */
  public static final String RATE_LIMIT_SALT = "tessera-rate-limit-v1";

  /**
   * Salt for log correlation hashes. Keeps the first 16 hex characters.
   */
  public static final String LOGGING_SALT = "tessera-logging-v1";

  private Hashing() {
  }

  /**
   * SHA-256 of the input.
   *
   * @param data the data
   * @return the 32-byte digest
   */
  public static byte[] sha256(byte[] data) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(data, 0, data.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }

  /**
   * Lowercase hex SHA-256 of the UTF-8 bytes of {@code value}.
   *
   * @param value the value
   * @return 64 hex characters
   */
  public static String sha256Hex(String value) {
    return Hex.toHexString(sha256(value.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Hex SHA-256 of {@code value ∥ salt}, truncated to {@code hexChars} characters.
   *
   * @param value    the value
   * @param salt     the salt appended to the value
   * @param hexChars number of leading hex characters to keep (at most 64)
   * @return the truncated hash
   */
  public static String saltedHash(String value, String salt, int hexChars) {
    if (hexChars < 1 || hexChars > 64) {
      throw new IllegalArgumentException("hexChars must be within [1,64]");
    }
    return sha256Hex(value + salt).substring(0, hexChars);
  }

  /**
   * Rate-limit key component for an identifier or IP address.
   *
   * @param value the value
   * @return 32 hex characters
   */
  public static String forRateLimit(String value) {
    return saltedHash(value, RATE_LIMIT_SALT, 32);
  }

  /**
   * Short correlation hash that may appear in logs.
   *
   * @param value the value
   * @return 16 hex characters, or {@code "none"} for null input
   */
  public static String forLogging(String value) {
    if (value == null) {
      return "none";
    }
    return saltedHash(value, LOGGING_SALT, 16);
  }
}
