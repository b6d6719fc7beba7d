package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One recovery code. Only rows with {@code usedAt == null} may be consumed.
 *
 * @param id        the id
 * @param userId    owning user
 * @param codeHash  Argon2id PHC string of the code
 * @param createdAt creation time
 * @param usedAt    consumption time, may be null
 */
public record RecoveryCode(UUID id, UUID userId, String codeHash, Instant createdAt, Instant usedAt) {
}
