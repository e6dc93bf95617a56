package com.codeheadsystems.tessera.server.store;

import com.codeheadsystems.tessera.server.auth.AuthMethod;
import java.time.Instant;

/**
 * Data stored for an issued session token.
 *
 * @param subject   hashed identifier the token was issued to
 * @param method    how the subject authenticated
 * @param issuedAt  when the token was issued
 * @param expiresAt when the token expires
 */
public record SessionData(
    String subject,
    AuthMethod method,
    Instant issuedAt,
    Instant expiresAt) {
}
