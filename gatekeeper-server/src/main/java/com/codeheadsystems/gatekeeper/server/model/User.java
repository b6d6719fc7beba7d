package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * An account. Owned by the persistence layer; everything else refers to it by id.
 *
 * @param id                 the id
 * @param username           unique login name
 * @param displayName        display name
 * @param role               role tag, e.g. "admin" or "student"
 * @param email              optional email
 * @param passwordHash       optional Argon2id PHC string
 * @param allowPasswordLogin whether password login is permitted
 * @param mustChangePassword whether the user must change the password on next login
 * @param passwordUpdatedAt  when the password was last set, may be null
 * @param active             whether the account may authenticate
 * @param createdAt          creation time
 */
public record User(UUID id,
                   String username,
                   String displayName,
                   String role,
                   String email,
                   String passwordHash,
                   boolean allowPasswordLogin,
                   boolean mustChangePassword,
                   Instant passwordUpdatedAt,
                   boolean active,
                   Instant createdAt) {

  /**
   * Copy with a new password hash, enabling password login and clearing the must-change flag.
   *
   * @param hash the hash
   * @param now  the time of the change
   * @return the user
   */
  public User withPassword(String hash, Instant now) {
    return new User(id, username, displayName, role, email, hash, true, false, now, active, createdAt);
  }

  /**
   * Copy with an admin-assigned password that must be replaced at the next opportunity.
   *
   * @param hash the hash
   * @param now  the time of the change
   * @return the user
   */
  public User withTemporaryPassword(String hash, Instant now) {
    return new User(id, username, displayName, role, email, hash, true, true, now, active, createdAt);
  }

  /**
   * Copy with the active flag replaced.
   *
   * @param isActive the new flag
   * @return the user
   */
  public User withActive(boolean isActive) {
    return new User(id, username, displayName, role, email, passwordHash, allowPasswordLogin,
        mustChangePassword, passwordUpdatedAt, isActive, createdAt);
  }

  public boolean hasPassword() {
    return passwordHash != null && !passwordHash.isEmpty();
  }
}
