package com.codeheadsystems.tessera.server.error;

/**
 * Failure taxonomy shared by the core and the HTTP adapters. Each code carries its HTTP status
 * and a fixed client-facing message; detail goes to logs and audit only.
 */
public enum ErrorCode {
  VALIDATION(400, "Invalid request"),
  NOT_FOUND(404, "Session not found"),
  EXPIRED(410, "Session expired"),
  ALREADY_USED(409, "Session already used"),
  ATTEMPTS_EXCEEDED(429, "Too many verification attempts"),
  RATE_LIMITED(429, "Too many requests"),
  DECRYPTION(400, "Unable to decrypt credentials"),
  ASSERTION_INVALID(401, "Authentication failed"),
  CREDENTIAL_NOT_FOUND_OR_INACTIVE(401, "Credential not found or inactive"),
  CLONE_DETECTED(401, "Security key disabled"),
  CONFIGURATION(503, "Service unavailable"),
  INTERNAL(500, "Internal error");

  private final int httpStatus;
  private final String message;

  ErrorCode(int httpStatus, String message) {
    this.httpStatus = httpStatus;
    this.message = message;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public String message() {
    return message;
  }
}
