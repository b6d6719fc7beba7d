package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.PasskeyCredential;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for passkeys. Credential ids are globally unique. Implementations must be thread-safe.
 */
public interface PasskeyStore {

  /**
   * Inserts a credential.
   *
   * @param credential the credential
   * @throws DuplicateKeyException if the credential id already exists for any user
   */
  void insert(PasskeyCredential credential);

  Optional<PasskeyCredential> findByCredentialId(String credentialId);

  List<PasskeyCredential> listByUserId(UUID userId);

  /**
   * Replaces the authenticator state and last-used time of an existing credential.
   *
   * @param credential the credential
   */
  void update(PasskeyCredential credential);

  void deleteByCredentialId(String credentialId);

  /**
   * Deletes every credential of the user.
   *
   * @param userId the user id
   * @return the number deleted
   */
  int deleteByUserId(UUID userId);
}
