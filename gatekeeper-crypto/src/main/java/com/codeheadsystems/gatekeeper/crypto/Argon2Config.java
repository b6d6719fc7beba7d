package com.codeheadsystems.gatekeeper.crypto;

/**
 * Argon2id cost parameters used when producing new password and recovery-code hashes.
 * Verification reads the parameters stored in the hash string instead.
 *
 * @param memoryKib   memory cost in KiB
 * @param iterations  time cost
 * @param parallelism lanes
 */
public record Argon2Config(int memoryKib, int iterations, int parallelism) {

  /**
   * Production parameters.
   */
  public static final Argon2Config DEFAULT = new Argon2Config(65536, 3, 1);

  /**
   * Instantiates a new Argon2 config.
   */
  public Argon2Config {
    if (memoryKib < 8 * parallelism || iterations < 1 || parallelism < 1) {
      throw new IllegalArgumentException("Invalid Argon2id parameters");
    }
  }

  /**
   * Cheap parameters so test suites stay fast. Never use in production.
   *
   * @return the argon 2 config
   */
  public static Argon2Config forTesting() {
    return new Argon2Config(1024, 1, 1);
  }
}
