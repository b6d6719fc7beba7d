package com.codeheadsystems.gatekeeper.crypto;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random generation.
 * Used for envelope nonces, Argon2id salts, session tokens, time-boxed tokens and recovery codes.
 */
public record RandomProvider(SecureRandom random) {

  private static final char[] ALPHANUMERIC =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Generates {@code len} random bytes encoded as URL-safe base64 without padding.
   *
   * @param len the number of random bytes
   * @return the encoded token
   */
  public String urlSafeToken(int len) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes(len));
  }

  /**
   * Generates a random string drawn uniformly from {@code [A-Za-z0-9]}.
   *
   * @param len the number of characters
   * @return the random string
   */
  public String alphanumeric(int len) {
    StringBuilder sb = new StringBuilder(len);
    for (int i = 0; i < len; i++) {
      sb.append(ALPHANUMERIC[random.nextInt(ALPHANUMERIC.length)]);
    }
    return sb.toString();
  }
}
