package com.codeheadsystems.gatekeeper.server.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local map of short-lived entries, used for pending passkey ceremonies and re-authentication
 * grants. Nothing here is persisted; a restart drops every entry.
 * <p>
 * Every operation holds the instance monitor for its full duration. Entries older than the TTL are
 * evicted lazily on each {@link #put} and {@link #take}; there is no background sweep.
 * {@link #take} removes and returns in one step, so a key is consumed at most once.
 * <p>
 * <strong>Exception contract:</strong> {@link #put} throws {@link IllegalStateException} when the
 * store is at capacity after eviction.
 *
 * @param <V> the value type
 */
public class EphemeralStore<V> {

  private static final Logger log = LoggerFactory.getLogger(EphemeralStore.class);

  /**
   * Maximum concurrent entries.
   * A client spamming start calls without finishing could otherwise cause OOM.
   */
  public static final int DEFAULT_CAPACITY = 10_000;

  private final String name;
  private final Duration ttl;
  private final int capacity;
  private final Clock clock;
  private final Map<String, Entry<V>> entries = new HashMap<>();

  public EphemeralStore(String name, Duration ttl, Clock clock) {
    this(name, ttl, DEFAULT_CAPACITY, clock);
  }

  public EphemeralStore(String name, Duration ttl, int capacity, Clock clock) {
    this.name = name;
    this.ttl = ttl;
    this.capacity = capacity;
    this.clock = clock;
  }

  public String name() {
    return name;
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Stores a value.
   *
   * @param key   the key
   * @param value the value
   * @throws IllegalStateException if the store is full
   */
  public synchronized void put(String key, V value) {
    Instant now = clock.instant();
    evictExpired(now);
    if (entries.size() >= capacity) {
      log.warn("{} at capacity ({})", name, capacity);
      throw new IllegalStateException("Too many pending entries in " + name);
    }
    entries.put(key, new Entry<>(value, now));
  }

  /**
   * Removes and returns a live value.
   *
   * @param key the key
   * @return the value, or empty if unknown, already taken or expired
   */
  public synchronized Optional<V> take(String key) {
    evictExpired(clock.instant());
    Entry<V> entry = entries.remove(key);
    return entry == null ? Optional.empty() : Optional.of(entry.value());
  }

  /**
   * Number of live entries, after eviction.
   *
   * @return the size
   */
  public synchronized int size() {
    evictExpired(clock.instant());
    return entries.size();
  }

  /**
   * Drops every entry. Called on shutdown.
   */
  public synchronized void clear() {
    entries.clear();
  }

  private void evictExpired(Instant now) {
    Instant cutoff = now.minus(ttl);
    int before = entries.size();
    entries.values().removeIf(e -> e.createdAt().isBefore(cutoff));
    if (entries.size() != before) {
      log.debug("{}: evicted {} expired entr(ies)", name, before - entries.size());
    }
  }

  private record Entry<V>(V value, Instant createdAt) {
  }
}
