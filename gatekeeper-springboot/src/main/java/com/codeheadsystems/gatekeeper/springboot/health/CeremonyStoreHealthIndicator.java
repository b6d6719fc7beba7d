package com.codeheadsystems.gatekeeper.springboot.health;

import com.codeheadsystems.gatekeeper.server.passkey.PendingCeremony;
import com.codeheadsystems.gatekeeper.server.store.EphemeralStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports DOWN once the pending-ceremony store is full, because every new passkey ceremony would
 * then be refused.
 */
public class CeremonyStoreHealthIndicator implements HealthIndicator {

  private final EphemeralStore<PendingCeremony> pending;

  public CeremonyStoreHealthIndicator(EphemeralStore<PendingCeremony> pending) {
    this.pending = pending;
  }

  @Override
  public Health health() {
    int size = pending.size();
    int capacity = pending.capacity();
    Health.Builder builder = size >= capacity ? Health.down().withDetail("reason", "ceremony store is full")
        : Health.up();
    return builder
        .withDetail("store", pending.name())
        .withDetail("pending", size)
        .withDetail("capacity", capacity)
        .build();
  }
}
