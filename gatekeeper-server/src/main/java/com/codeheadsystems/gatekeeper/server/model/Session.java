package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A persisted session. Only the SHA-256 hex of the bearer token is stored.
 *
 * @param tokenHash  hex SHA-256 of the raw token
 * @param userId     owning user
 * @param createdAt  creation time
 * @param expiresAt  expiry
 * @param lastSeenAt last validated use
 */
public record Session(String tokenHash, UUID userId, Instant createdAt, Instant expiresAt, Instant lastSeenAt) {
}
