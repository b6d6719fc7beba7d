package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.Device;
import com.codeheadsystems.gatekeeper.server.model.DeviceKind;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for device labels. Implementations must be thread-safe.
 */
public interface DeviceStore {

  void insert(Device device);

  List<Device> listByUserId(UUID userId);

  Optional<Device> findById(UUID id);

  Optional<Device> findByCredentialId(String credentialId);

  void update(Device device);

  void delete(UUID id);

  int deleteByUserIdAndKind(UUID userId, DeviceKind kind);
}
