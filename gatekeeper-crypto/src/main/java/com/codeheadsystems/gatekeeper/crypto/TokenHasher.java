package com.codeheadsystems.gatekeeper.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;
import org.bouncycastle.util.encoders.Hex;

/**
 * Fast, deterministic SHA-256 hashing for high-entropy bearer tokens. The hex digest is only
 * ever used as a lookup key; the raw token is never stored.
 */
public class TokenHasher {

  /**
   * Lowercase hex SHA-256 of the UTF-8 token.
   *
   * @param rawToken the raw token
   * @return the hex digest
   */
  public String hash(String rawToken) {
    return Hex.toHexString(sha256(rawToken.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Label used in audit logs for a recovery code: SHA-256 over the user id bytes followed by the code.
   *
   * @param userId the user id
   * @param code   the raw code
   * @return the hex label
   */
  public String auditLabel(UUID userId, String code) {
    ByteBuffer idBytes = ByteBuffer.allocate(16)
        .putLong(userId.getMostSignificantBits())
        .putLong(userId.getLeastSignificantBits());
    return Hex.toHexString(sha256(ByteUtils.concat(idBytes.array(), code.getBytes(StandardCharsets.UTF_8))));
  }

  private static byte[] sha256(byte[] input) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(input);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
