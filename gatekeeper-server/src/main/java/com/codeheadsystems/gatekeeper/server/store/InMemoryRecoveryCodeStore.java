package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.RecoveryCode;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link RecoveryCodeStore}.
 */
public class InMemoryRecoveryCodeStore implements RecoveryCodeStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRecoveryCodeStore.class);

  private final ConcurrentHashMap<UUID, RecoveryCode> store = new ConcurrentHashMap<>();

  public InMemoryRecoveryCodeStore() {
    log.warn("Using InMemoryRecoveryCodeStore: recovery codes will NOT survive restarts.");
  }

  @Override
  public void insert(RecoveryCode code) {
    if (store.putIfAbsent(code.id(), code) != null) {
      throw new DuplicateKeyException("recovery code already exists");
    }
  }

  @Override
  public List<RecoveryCode> listUnusedByUserId(UUID userId) {
    return store.values().stream()
        .filter(c -> c.userId().equals(userId) && c.usedAt() == null)
        .toList();
  }

  @Override
  public boolean markUsed(UUID id, Instant now) {
    AtomicBoolean updated = new AtomicBoolean(false);
    store.computeIfPresent(id, (k, code) -> {
      if (code.usedAt() != null) {
        return code;
      }
      updated.set(true);
      return new RecoveryCode(code.id(), code.userId(), code.codeHash(), code.createdAt(), now);
    });
    return updated.get();
  }

  @Override
  public int deleteByUserId(UUID userId) {
    List<UUID> ids = store.values().stream().filter(c -> c.userId().equals(userId)).map(RecoveryCode::id).toList();
    ids.forEach(store::remove);
    return ids.size();
  }
}
