package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.Session;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All sessions are lost on server restart. Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, Session> store = new ConcurrentHashMap<>();
  // Reverse index: userId → set of token hashes, kept in sync with store.
  private final ConcurrentHashMap<UUID, Set<String>> userToHashes = new ConcurrentHashMap<>();

  public InMemorySessionStore() {
    log.warn("Using InMemorySessionStore: sessions will NOT survive restarts.");
  }

  @Override
  public void insert(Session session) {
    store.put(session.tokenHash(), session);
    // compute() holds the bin lock, so a concurrent deleteByUserId cannot drop the set mid-add.
    userToHashes.compute(session.userId(), (k, hashes) -> {
      Set<String> target = hashes == null ? ConcurrentHashMap.newKeySet() : hashes;
      target.add(session.tokenHash());
      return target;
    });
    log.debug("Stored session for user {}", session.userId());
  }

  @Override
  public Optional<Session> findByTokenHash(String tokenHash) {
    return Optional.ofNullable(store.get(tokenHash));
  }

  @Override
  public void touch(String tokenHash, Instant now) {
    store.computeIfPresent(tokenHash,
        (k, s) -> new Session(s.tokenHash(), s.userId(), s.createdAt(), s.expiresAt(), now));
  }

  @Override
  public void deleteByTokenHash(String tokenHash) {
    Session session = store.remove(tokenHash);
    if (session != null) {
      userToHashes.computeIfPresent(session.userId(), (k, hashes) -> {
        hashes.remove(tokenHash);
        return hashes.isEmpty() ? null : hashes;
      });
    }
  }

  @Override
  public int deleteByUserId(UUID userId) {
    int[] removed = {0};
    userToHashes.computeIfPresent(userId, (k, hashes) -> {
      for (String hash : hashes) {
        if (store.remove(hash) != null) {
          removed[0]++;
        }
      }
      return null;
    });
    return removed[0];
  }

  @Override
  public int countByUserId(UUID userId) {
    Set<String> hashes = userToHashes.get(userId);
    return hashes == null ? 0 : (int) hashes.stream().filter(store::containsKey).count();
  }
}
