package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.User;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserStore}.
 */
public class InMemoryUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserStore.class);

  private final ConcurrentHashMap<UUID, User> byId = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, UUID> byUsername = new ConcurrentHashMap<>();

  public InMemoryUserStore() {
    log.warn("Using InMemoryUserStore: accounts will NOT survive restarts.");
  }

  @Override
  public synchronized void insert(User user) {
    if (byId.containsKey(user.id()) || byUsername.containsKey(user.username())) {
      throw new DuplicateKeyException("user already exists");
    }
    byId.put(user.id(), user);
    byUsername.put(user.username(), user.id());
  }

  @Override
  public Optional<User> findById(UUID id) {
    return Optional.ofNullable(byId.get(id));
  }

  @Override
  public Optional<User> findByUsername(String username) {
    return Optional.ofNullable(byUsername.get(username)).map(byId::get);
  }

  @Override
  public List<User> findByRole(String role) {
    return byId.values().stream().filter(u -> u.role().equals(role)).toList();
  }

  @Override
  public long count() {
    return byId.size();
  }

  @Override
  public synchronized void update(User user) {
    User previous = byId.get(user.id());
    if (previous == null) {
      return;
    }
    if (!previous.username().equals(user.username())) {
      if (byUsername.containsKey(user.username())) {
        throw new DuplicateKeyException("username already exists");
      }
      byUsername.remove(previous.username());
      byUsername.put(user.username(), user.id());
    }
    byId.put(user.id(), user);
  }
}
