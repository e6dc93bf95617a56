package com.codeheadsystems.tessera.server.store;

import java.util.Optional;

/**
 * Storage for issued session tokens, keyed by JWT ID.
 * <p>
 * Implementations must be thread-safe and must support revoking every session of a subject
 * without scanning the whole store: a credential disabled by clone detection revokes all of its
 * owner's sessions at once.
 */
public interface SessionStore {

  void store(String jti, SessionData sessionData);

  /**
   * Loads session data by JWT ID.
   *
   * @param jti the token id
   * @return the session data, or empty if unknown, revoked or expired
   */
  Optional<SessionData> load(String jti);

  void revoke(String jti);

  /**
   * Revokes every session of a subject. A subject without sessions is not an error.
   *
   * @param subject the hashed identifier
   * @return the number of sessions revoked
   */
  int revokeBySubject(String subject);

  /**
   * Removes sessions whose expiry has passed, along with any subject index left empty.
   *
   * @return the number of sessions removed
   */
  int purgeExpired();
}
