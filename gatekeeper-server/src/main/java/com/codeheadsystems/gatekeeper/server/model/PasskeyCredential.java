package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A registered passkey. The credential id is globally unique and persisted as unpadded base64url.
 * The authenticator state is an opaque blob owned by the passkey protocol.
 *
 * @param credentialId       base64url credential id
 * @param userId             owning user
 * @param authenticatorState serialized protocol state (public key, signature counter, flags)
 * @param createdAt          creation time
 * @param lastUsedAt         last successful use, may be null
 */
public record PasskeyCredential(String credentialId,
                                UUID userId,
                                String authenticatorState,
                                Instant createdAt,
                                Instant lastUsedAt) {

  public PasskeyCredential withState(String state, Instant usedAt) {
    return new PasskeyCredential(credentialId, userId, state, createdAt, usedAt);
  }
}
