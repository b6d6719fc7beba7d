package com.codeheadsystems.gatekeeper.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.util.Arrays;

/**
 * Slow, salted hashing for passwords and recovery codes (Argon2id).
 *
 * <p>Output is the PHC string format:
 * {@code $argon2id$v=19$m=<kib>,t=<iterations>,p=<lanes>$<salt>$<hash>} with unpadded base64,
 * so verification needs nothing but the stored string.
 *
 * <p><b>Exception contract:</b>
 * <ul>
 *   <li>{@link #verify(String, String)} returns {@code false} for a wrong secret; it never throws for that.</li>
 *   <li>{@link MalformedHashException} is thrown only when the stored string cannot be parsed.</li>
 * </ul>
 */
public class PasswordHasher {

  private static final String PREFIX = "$argon2id$";
  private static final int SALT_LENGTH = 16;
  private static final int HASH_LENGTH = 32;
  private static final Base64.Encoder B64_ENCODER = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64_DECODER = Base64.getDecoder();

  private final Argon2Config config;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Password hasher.
   *
   * @param config         cost parameters for new hashes
   * @param randomProvider source of salts
   */
  public PasswordHasher(Argon2Config config, RandomProvider randomProvider) {
    this.config = config;
    this.randomProvider = randomProvider;
  }

  /**
   * Hashes the secret with a fresh salt.
   *
   * @param secret the secret
   * @return the PHC string
   */
  public String hash(String secret) {
    byte[] salt = randomProvider.randomBytes(SALT_LENGTH);
    byte[] hash = argon2id(secret, salt, config.memoryKib(), config.iterations(), config.parallelism(), HASH_LENGTH);
    return PREFIX + "v=19$m=" + config.memoryKib() + ",t=" + config.iterations() + ",p=" + config.parallelism()
        + "$" + B64_ENCODER.encodeToString(salt) + "$" + B64_ENCODER.encodeToString(hash);
  }

  /**
   * Verifies a candidate against a stored hash in constant time with respect to the hash bytes.
   *
   * @param candidate the candidate secret
   * @param stored    the stored PHC string
   * @return true if the candidate matches
   * @throws MalformedHashException if the stored string is not a valid Argon2id PHC string
   */
  public boolean verify(String candidate, String stored) {
    ParsedHash parsed = parse(stored);
    byte[] computed = argon2id(candidate, parsed.salt(), parsed.memoryKib(), parsed.iterations(),
        parsed.parallelism(), parsed.hash().length);
    return Arrays.constantTimeAreEqual(computed, parsed.hash());
  }

  private static byte[] argon2id(String secret, byte[] salt, int memory, int iterations, int parallelism, int length) {
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(memory)
        .withIterations(iterations)
        .withParallelism(parallelism)
        .build();
    gen.init(params);
    byte[] output = new byte[length];
    gen.generateBytes(secret.getBytes(StandardCharsets.UTF_8), output, 0, output.length);
    return output;
  }

  private static ParsedHash parse(String stored) {
    if (stored == null || !stored.startsWith(PREFIX)) {
      throw new MalformedHashException("Stored hash is not argon2id");
    }
    // ["", "argon2id", "v=19", "m=..,t=..,p=..", salt, hash]
    String[] parts = stored.split("\\$");
    if (parts.length != 6 || !"v=19".equals(parts[2])) {
      throw new MalformedHashException("Stored hash has an unexpected layout");
    }
    try {
      int memory = -1;
      int iterations = -1;
      int parallelism = -1;
      for (String kv : parts[3].split(",")) {
        String[] pair = kv.split("=", 2);
        if (pair.length != 2) {
          throw new MalformedHashException("Stored hash has a bad parameter block");
        }
        int value = Integer.parseInt(pair[1]);
        switch (pair[0]) {
          case "m" -> memory = value;
          case "t" -> iterations = value;
          case "p" -> parallelism = value;
          default -> throw new MalformedHashException("Unknown argon2 parameter " + pair[0]);
        }
      }
      byte[] salt = B64_DECODER.decode(parts[4]);
      byte[] hash = B64_DECODER.decode(parts[5]);
      if (memory < 1 || iterations < 1 || parallelism < 1 || salt.length < 8 || hash.length < 16) {
        throw new MalformedHashException("Stored hash has out-of-range parameters");
      }
      return new ParsedHash(memory, iterations, parallelism, salt, hash);
    } catch (IllegalArgumentException e) {
      throw new MalformedHashException("Stored hash could not be decoded", e);
    }
  }

  private record ParsedHash(int memoryKib, int iterations, int parallelism, byte[] salt, byte[] hash) {
  }
}
