package com.codeheadsystems.tessera.crypto.exceptions;

/**
 * Fatal configuration problem: KDF parameters outside the permitted range in production,
 * or key derivation exceeding its hard timeout.
 */
public class ConfigurationException extends IllegalStateException {

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   */
  public ConfigurationException(String message) {
    super(message);
  }

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
