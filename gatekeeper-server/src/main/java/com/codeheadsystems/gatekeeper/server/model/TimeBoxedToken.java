package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A single-use invite or reset token. Reset tokens target an existing user; invites carry a
 * profile instead because the account does not exist yet.
 *
 * @param id        the id
 * @param tokenHash hex SHA-256 of the raw token
 * @param purpose   the purpose
 * @param userId    target user, null for invites
 * @param profile   invite profile, null for resets
 * @param createdAt creation time
 * @param expiresAt expiry
 * @param usedAt    consumption time, may be null
 */
public record TimeBoxedToken(UUID id,
                             String tokenHash,
                             TokenPurpose purpose,
                             UUID userId,
                             InviteProfile profile,
                             Instant createdAt,
                             Instant expiresAt,
                             Instant usedAt) {

  public boolean isExpired(Instant now) {
    return expiresAt.isBefore(now);
  }
}
