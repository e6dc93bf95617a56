package com.codeheadsystems.tessera.server.ratelimit;

/**
 * Independent rate-limit namespaces. The prefix keeps counters of different scopes apart even
 * when their hashed subjects collide.
 */
public enum RateLimitScope {
  OTP_INITIATE_IP("otp-initiate-ip"),
  OTP_INITIATE_IDENTIFIER("otp-initiate-id"),
  OTP_VERIFY_SESSION("otp-verify-session"),
  OTP_VERIFY_IP("otp-verify-ip"),
  WEBAUTHN_START_IP("webauthn-start-ip");

  private final String prefix;

  RateLimitScope(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }
}
