package com.codeheadsystems.gatekeeper.server.passkey;

import java.time.Instant;
import java.util.UUID;

/**
 * A started ceremony awaiting its finish call. Process-local, never persisted.
 *
 * @param type          the ceremony type
 * @param userId        the target user
 * @param protocolState opaque protocol state
 * @param createdAt     start time
 */
public record PendingCeremony(CeremonyType type, UUID userId, String protocolState, Instant createdAt) {
}
