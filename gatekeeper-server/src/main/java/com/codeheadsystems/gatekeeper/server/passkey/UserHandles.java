package com.codeheadsystems.gatekeeper.server.passkey;

import com.yubico.webauthn.data.ByteArray;
import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.UUID;

/**
 * Conversion between user ids and the 16-byte WebAuthn user handle.
 */
final class UserHandles {

  private UserHandles() {
  }

  static ByteArray toHandle(UUID userId) {
    return new ByteArray(ByteBuffer.allocate(16)
        .putLong(userId.getMostSignificantBits())
        .putLong(userId.getLeastSignificantBits())
        .array());
  }

  static Optional<UUID> fromHandle(ByteArray handle) {
    if (handle == null || handle.size() != 16) {
      return Optional.empty();
    }
    ByteBuffer buffer = ByteBuffer.wrap(handle.getBytes());
    return Optional.of(new UUID(buffer.getLong(), buffer.getLong()));
  }
}
