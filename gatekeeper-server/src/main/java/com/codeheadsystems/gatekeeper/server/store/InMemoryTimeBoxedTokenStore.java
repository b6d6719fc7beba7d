package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.TimeBoxedToken;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link TimeBoxedTokenStore}.
 */
public class InMemoryTimeBoxedTokenStore implements TimeBoxedTokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTimeBoxedTokenStore.class);

  private final ConcurrentHashMap<String, TimeBoxedToken> byHash = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<UUID, String> idToHash = new ConcurrentHashMap<>();

  public InMemoryTimeBoxedTokenStore() {
    log.warn("Using InMemoryTimeBoxedTokenStore: invites and resets will NOT survive restarts.");
  }

  @Override
  public void insert(TimeBoxedToken token) {
    if (byHash.putIfAbsent(token.tokenHash(), token) != null) {
      throw new DuplicateKeyException("token hash already exists");
    }
    idToHash.put(token.id(), token.tokenHash());
  }

  @Override
  public Optional<TimeBoxedToken> findUnusedByHash(String tokenHash) {
    return Optional.ofNullable(byHash.get(tokenHash)).filter(t -> t.usedAt() == null);
  }

  @Override
  public boolean markUsed(UUID id, Instant now) {
    String hash = idToHash.get(id);
    if (hash == null) {
      return false;
    }
    AtomicBoolean updated = new AtomicBoolean(false);
    byHash.computeIfPresent(hash, (k, t) -> {
      if (t.usedAt() != null) {
        return t;
      }
      updated.set(true);
      return new TimeBoxedToken(t.id(), t.tokenHash(), t.purpose(), t.userId(), t.profile(), t.createdAt(),
          t.expiresAt(), now);
    });
    return updated.get();
  }
}
