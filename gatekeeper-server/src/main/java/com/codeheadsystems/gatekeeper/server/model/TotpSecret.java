package com.codeheadsystems.gatekeeper.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A TOTP secret row. The secret itself is only ever held as an envelope.
 *
 * @param id             the id, doubles as the enrollment id
 * @param userId         owning user
 * @param secretEnvelope encrypted base32 secret
 * @param enabled        whether the row has been verified and may be used for login
 * @param createdAt      creation time
 * @param verifiedAt     verification time, null while pending
 */
public record TotpSecret(UUID id,
                         UUID userId,
                         String secretEnvelope,
                         boolean enabled,
                         Instant createdAt,
                         Instant verifiedAt) {

  public TotpSecret enable(Instant now) {
    return new TotpSecret(id, userId, secretEnvelope, true, createdAt, now);
  }

  public TotpSecret disable() {
    return new TotpSecret(id, userId, secretEnvelope, false, createdAt, verifiedAt);
  }
}
