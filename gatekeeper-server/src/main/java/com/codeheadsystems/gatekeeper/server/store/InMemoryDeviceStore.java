package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.Device;
import com.codeheadsystems.gatekeeper.server.model.DeviceKind;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link DeviceStore}.
 */
public class InMemoryDeviceStore implements DeviceStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDeviceStore.class);

  private final ConcurrentHashMap<UUID, Device> store = new ConcurrentHashMap<>();

  public InMemoryDeviceStore() {
    log.warn("Using InMemoryDeviceStore: device labels will NOT survive restarts.");
  }

  @Override
  public void insert(Device device) {
    if (store.putIfAbsent(device.id(), device) != null) {
      throw new DuplicateKeyException("device already exists");
    }
  }

  @Override
  public List<Device> listByUserId(UUID userId) {
    return store.values().stream()
        .filter(d -> d.userId().equals(userId))
        .sorted(Comparator.comparing(Device::createdAt))
        .toList();
  }

  @Override
  public Optional<Device> findById(UUID id) {
    return Optional.ofNullable(store.get(id));
  }

  @Override
  public Optional<Device> findByCredentialId(String credentialId) {
    return store.values().stream().filter(d -> credentialId.equals(d.credentialId())).findFirst();
  }

  @Override
  public void update(Device device) {
    store.computeIfPresent(device.id(), (k, existing) -> device);
  }

  @Override
  public void delete(UUID id) {
    store.remove(id);
  }

  @Override
  public int deleteByUserIdAndKind(UUID userId, DeviceKind kind) {
    List<UUID> ids = store.values().stream()
        .filter(d -> d.userId().equals(userId) && d.kind() == kind)
        .map(Device::id)
        .toList();
    ids.forEach(store::remove);
    return ids.size();
  }
}
