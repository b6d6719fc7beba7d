package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.PasskeyCredential;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link PasskeyStore} keyed by credential id.
 */
public class InMemoryPasskeyStore implements PasskeyStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryPasskeyStore.class);

  private final ConcurrentHashMap<String, PasskeyCredential> store = new ConcurrentHashMap<>();

  public InMemoryPasskeyStore() {
    log.warn("Using InMemoryPasskeyStore: passkeys will NOT survive restarts.");
  }

  @Override
  public void insert(PasskeyCredential credential) {
    if (store.putIfAbsent(credential.credentialId(), credential) != null) {
      throw new DuplicateKeyException("credential already registered");
    }
  }

  @Override
  public Optional<PasskeyCredential> findByCredentialId(String credentialId) {
    return Optional.ofNullable(store.get(credentialId));
  }

  @Override
  public List<PasskeyCredential> listByUserId(UUID userId) {
    return store.values().stream()
        .filter(c -> c.userId().equals(userId))
        .sorted(Comparator.comparing(PasskeyCredential::createdAt))
        .toList();
  }

  @Override
  public void update(PasskeyCredential credential) {
    store.computeIfPresent(credential.credentialId(), (k, existing) -> credential);
  }

  @Override
  public void deleteByCredentialId(String credentialId) {
    store.remove(credentialId);
  }

  @Override
  public int deleteByUserId(UUID userId) {
    List<String> ids = store.values().stream()
        .filter(c -> c.userId().equals(userId))
        .map(PasskeyCredential::credentialId)
        .toList();
    ids.forEach(store::remove);
    return ids.size();
  }
}
