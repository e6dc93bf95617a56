package com.codeheadsystems.tessera.crypto.common;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.util.Arrays;

/**
 * Byte array helpers shared by the cipher envelope and the hash comparisons.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Copies {@code length} bytes of {@code source} starting at {@code offset}.
   *
   * @param source the source
   * @param offset the start offset
   * @param length the number of bytes
   * @return the byte [ ]
   */
  public static byte[] slice(byte[] source, int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > source.length) {
      throw new IllegalArgumentException("Slice out of bounds: offset=" + offset
          + " length=" + length + " size=" + source.length);
    }
    byte[] out = new byte[length];
    System.arraycopy(source, offset, out, 0, length);
    return out;
  }

  /**
   * Compares two arrays in time that depends only on their length, never on the
   * position of the first differing byte.
   *
   * @param a the a
   * @param b the b
   * @return true when both arrays hold the same bytes
   */
  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    if (a == null || b == null) {
      return false;
    }
    return Arrays.constantTimeAreEqual(a, b);
  }

  /**
   * Constant-time comparison of two strings by their UTF-8 bytes.
   *
   * @param a the a
   * @param b the b
   * @return true when equal
   */
  public static boolean constantTimeEquals(String a, String b) {
    if (a == null || b == null) {
      return false;
    }
    return constantTimeEquals(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Overwrites the array with zeros. Null-safe.
   *
   * @param secret the secret
   */
  public static void wipe(byte[] secret) {
    if (secret != null) {
      Arrays.fill(secret, (byte) 0);
    }
  }
}
