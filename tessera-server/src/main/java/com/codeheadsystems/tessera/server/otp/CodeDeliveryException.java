package com.codeheadsystems.tessera.server.otp;

/**
 * A code could not be handed to its delivery channel.
 */
public class CodeDeliveryException extends RuntimeException {

  public CodeDeliveryException(String message) {
    super(message);
  }

  public CodeDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
