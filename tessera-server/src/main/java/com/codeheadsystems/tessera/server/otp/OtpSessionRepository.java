package com.codeheadsystems.tessera.server.otp;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for OTP sessions.
 * <p>
 * Implementations must be thread-safe. The two conditional updates must each be a single atomic
 * operation on the stored row (a conditional UPDATE, a compare-and-set), never a read followed
 * by a write: concurrent verifications of one session may never both consume the same attempt
 * or both succeed.
 */
public interface OtpSessionRepository {

  void save(OtpSession session);

  Optional<OtpSession> find(String sessionId);

  /**
   * Increments the attempt counter if the session exists, is unused, is not expired at
   * {@code now} and has fewer than {@code maxAttempts} attempts.
   *
   * @param sessionId   the session
   * @param maxAttempts attempt ceiling
   * @param now         the current time
   * @return the updated session, or empty if it was not verifiable
   */
  Optional<OtpSession> incrementAttemptsIfVerifiable(String sessionId, int maxAttempts, Instant now);

  /**
   * Marks the session used if it is not already.
   *
   * @param sessionId the session
   * @param now       the time of use
   * @return true if this call marked it
   */
  boolean markUsedIfUnused(String sessionId, Instant now);

  /**
   * Removes sessions expired at {@code now}. Idempotent.
   *
   * @param now the current time
   * @return the number removed
   */
  int deleteExpired(Instant now);

  long count();

  long countExpired(Instant now);
}
