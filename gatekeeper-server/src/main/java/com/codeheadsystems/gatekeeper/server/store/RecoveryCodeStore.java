package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.RecoveryCode;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Storage for recovery codes. Implementations must be thread-safe.
 */
public interface RecoveryCodeStore {

  void insert(RecoveryCode code);

  List<RecoveryCode> listUnusedByUserId(UUID userId);

  /**
   * Marks the code used only if it is still unused.
   *
   * @param id  the id
   * @param now the time of use
   * @return true if this call consumed the code
   */
  boolean markUsed(UUID id, Instant now);

  int deleteByUserId(UUID userId);
}
