package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.TotpSecret;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link TotpSecretStore}.
 */
public class InMemoryTotpSecretStore implements TotpSecretStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTotpSecretStore.class);

  private final ConcurrentHashMap<UUID, TotpSecret> store = new ConcurrentHashMap<>();

  public InMemoryTotpSecretStore() {
    log.warn("Using InMemoryTotpSecretStore: TOTP enrollments will NOT survive restarts.");
  }

  @Override
  public void insert(TotpSecret secret) {
    if (store.putIfAbsent(secret.id(), secret) != null) {
      throw new DuplicateKeyException("totp secret already exists");
    }
  }

  @Override
  public Optional<TotpSecret> findById(UUID id) {
    return Optional.ofNullable(store.get(id));
  }

  @Override
  public List<TotpSecret> listEnabledByUserId(UUID userId) {
    return store.values().stream()
        .filter(s -> s.userId().equals(userId) && s.enabled())
        .toList();
  }

  @Override
  public void update(TotpSecret secret) {
    store.computeIfPresent(secret.id(), (k, existing) -> secret);
  }

  @Override
  public int deleteByUserId(UUID userId) {
    List<UUID> ids = store.values().stream().filter(s -> s.userId().equals(userId)).map(TotpSecret::id).toList();
    ids.forEach(store::remove);
    return ids.size();
  }
}
