package com.codeheadsystems.tessera.server.otp;

/**
 * Point-in-time session counts.
 *
 * @param total   stored sessions
 * @param expired stored sessions past their expiry, awaiting cleanup
 */
public record OtpStatistics(long total, long expired) {
}
