package com.codeheadsystems.tessera.crypto.exceptions;

/**
 * The only failure {@code decrypt} reports. A malformed blob, a tag mismatch and a wrong
 * passphrase all produce the same message so callers cannot tell them apart.
 */
public class DecryptionException extends SecurityException {

  public static final String MESSAGE = "Unable to decrypt credentials";

  /**
   * Instantiates a new Decryption exception.
   */
  public DecryptionException() {
    super(MESSAGE);
  }

  /**
   * Instantiates a new Decryption exception keeping the cause for logs.
   *
   * @param cause the cause
   */
  public DecryptionException(Throwable cause) {
    super(MESSAGE, cause);
  }
}
