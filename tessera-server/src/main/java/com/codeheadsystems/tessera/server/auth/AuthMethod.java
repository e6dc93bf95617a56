package com.codeheadsystems.tessera.server.auth;

/**
 * How a session was authenticated; carried in the {@code amr} claim.
 */
public enum AuthMethod {
  OTP,
  WEBAUTHN
}
