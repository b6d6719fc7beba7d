package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.User;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for accounts. Usernames are unique. Implementations must be thread-safe.
 */
public interface UserStore {

  /**
   * Inserts a new user.
   *
   * @param user the user
   * @throws DuplicateKeyException if the id or username is taken
   */
  void insert(User user);

  Optional<User> findById(UUID id);

  Optional<User> findByUsername(String username);

  List<User> findByRole(String role);

  long count();

  /**
   * Replaces an existing user row.
   *
   * @param user the user
   */
  void update(User user);
}
