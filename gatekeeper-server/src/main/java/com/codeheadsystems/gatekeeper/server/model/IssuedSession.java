package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A freshly issued session. The raw token is returned exactly once for transport as a cookie whose
 * expiry mirrors {@code expiresAt}.
 *
 * @param rawToken  the bearer token
 * @param expiresAt the expiry
 * @param userId    the user
 */
public record IssuedSession(String rawToken, Instant expiresAt, UUID userId) {

  @Override
  public String toString() {
    return "IssuedSession[userId=" + userId + ", expiresAt=" + expiresAt + "]";
  }
}
