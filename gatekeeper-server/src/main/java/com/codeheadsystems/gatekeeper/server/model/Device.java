package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * User-facing label for an authenticator.
 *
 * @param id           the id
 * @param userId       owning user
 * @param kind         passkey or TOTP
 * @param label        label shown to the user
 * @param credentialId passkey credential id, null for TOTP devices
 * @param createdAt    creation time
 * @param lastUsedAt   last use, may be null
 */
public record Device(UUID id,
                     UUID userId,
                     DeviceKind kind,
                     String label,
                     String credentialId,
                     Instant createdAt,
                     Instant lastUsedAt) {

  public Device touch(Instant now) {
    return new Device(id, userId, kind, label, credentialId, createdAt, now);
  }
}
