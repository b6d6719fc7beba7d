package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.TotpSecret;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for TOTP secrets. Implementations must be thread-safe.
 */
public interface TotpSecretStore {

  void insert(TotpSecret secret);

  Optional<TotpSecret> findById(UUID id);

  List<TotpSecret> listEnabledByUserId(UUID userId);

  void update(TotpSecret secret);

  /**
   * Deletes every TOTP row of the user, pending or enabled.
   *
   * @param userId the user id
   * @return the number deleted
   */
  int deleteByUserId(UUID userId);
}
