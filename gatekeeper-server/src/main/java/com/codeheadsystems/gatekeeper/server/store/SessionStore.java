package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.Session;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage abstraction for sessions, keyed by the SHA-256 hex of the bearer token.
 * <p>
 * Implementations must be thread-safe.
 * <p>
 * <strong>Reset contract:</strong> when a credential or password reset happens for a user,
 * <em>all</em> sessions of that user are removed through {@link #deleteByUserId(UUID)} so that
 * bearer tokens issued before the reset stop being accepted immediately. Implementations must keep
 * whatever index is needed to do this without a full scan.
 */
public interface SessionStore {

  /**
   * Stores a session.
   *
   * @param session the session
   */
  void insert(Session session);

  /**
   * Loads a session by token hash. Expired sessions are returned; the caller decides.
   *
   * @param tokenHash hex SHA-256 of the bearer token
   * @return the session, or empty if not found
   */
  Optional<Session> findByTokenHash(String tokenHash);

  /**
   * Updates the last-seen time of a session if it exists.
   *
   * @param tokenHash the token hash
   * @param now       the time
   */
  void touch(String tokenHash, Instant now);

  /**
   * Deletes a single session.
   *
   * @param tokenHash the token hash
   */
  void deleteByTokenHash(String tokenHash);

  /**
   * Deletes <em>all</em> sessions of the user. Must not throw when there are none.
   *
   * @param userId the user id
   * @return the number of sessions deleted
   */
  int deleteByUserId(UUID userId);

  /**
   * Counts the sessions held for the user, expired or not.
   *
   * @param userId the user id
   * @return the count
   */
  int countByUserId(UUID userId);
}
