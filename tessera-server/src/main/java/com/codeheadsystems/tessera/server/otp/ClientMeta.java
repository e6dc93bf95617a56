package com.codeheadsystems.tessera.server.otp;

/**
 * Request context stored with an OTP session for audit.
 *
 * @param userAgent  the client's User-Agent header, may be null
 * @param ipAddress  the client's address, may be null
 * @param domainHint the domain the login was started from, may be null
 */
public record ClientMeta(String userAgent, String ipAddress, String domainHint) {

  public static final ClientMeta EMPTY = new ClientMeta(null, null, null);

  public static ClientMeta of(String userAgent, String ipAddress) {
    return new ClientMeta(userAgent, ipAddress, null);
  }
}
