package com.codeheadsystems.tessera.server.otp;

/**
 * Result of checking a code against a verifiable session.
 *
 * @param success           whether the code matched
 * @param hashedIdentifier  SHA-256 hex of the session's identifier
 * @param attemptsRemaining attempts left after this one
 */
public record OtpVerification(boolean success, String hashedIdentifier, int attemptsRemaining) {
}
