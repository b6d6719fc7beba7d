package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.TimeBoxedToken;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for invite and reset tokens. Implementations must be thread-safe.
 */
public interface TimeBoxedTokenStore {

  /**
   * Inserts a token.
   *
   * @param token the token
   * @throws DuplicateKeyException if the hash already exists
   */
  void insert(TimeBoxedToken token);

  /**
   * Finds a token by hash among rows whose {@code usedAt} is null. Expired rows are returned.
   *
   * @param tokenHash the token hash
   * @return the token
   */
  Optional<TimeBoxedToken> findUnusedByHash(String tokenHash);

  /**
   * Sets {@code usedAt} only where it is still null, as one atomic conditional update.
   *
   * @param id  the id
   * @param now the time of use
   * @return true if exactly this call consumed the token
   */
  boolean markUsed(UUID id, Instant now);
}
