package com.codeheadsystems.gatekeeper.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM envelope for secrets at rest.
 *
 * <p>Format: {@code versionTag + base64(nonce(12) || ciphertext || tag(16))}, standard alphabet.
 * A fresh nonce is drawn for every call to {@link #encrypt(byte[], byte[])}.
 *
 * <p><b>Exception contract:</b> every failure in {@link #decrypt(String, byte[])} is reported as
 * a {@link SecretEnvelopeException} with the same message, regardless of cause.
 */
public class SecretEnvelope {

  /**
   * Version tag for secrets stored by this library.
   */
  public static final String DEFAULT_TAG = "SECv1:";
  /**
   * The constant NONCE_LENGTH.
   */
  public static final int NONCE_LENGTH = 12;
  /**
   * The constant KEY_LENGTH.
   */
  public static final int KEY_LENGTH = 32;

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int TAG_BITS = 128;

  private final String versionTag;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Secret envelope.
   *
   * @param versionTag     the prefix written to and required on every envelope
   * @param randomProvider source of nonces
   */
  public SecretEnvelope(String versionTag, RandomProvider randomProvider) {
    if (versionTag == null || versionTag.isEmpty()) {
      throw new IllegalArgumentException("versionTag must not be empty");
    }
    this.versionTag = versionTag;
    this.randomProvider = randomProvider;
  }

  /**
   * Instantiates a new Secret envelope with the default tag.
   *
   * @param randomProvider the random provider
   */
  public SecretEnvelope(RandomProvider randomProvider) {
    this(DEFAULT_TAG, randomProvider);
  }

  /**
   * Version tag string.
   *
   * @return the string
   */
  public String versionTag() {
    return versionTag;
  }

  /**
   * Encrypts the plaintext under the given key.
   *
   * @param plaintext the plaintext, may be empty
   * @param key       32-byte AES key
   * @return the envelope
   */
  public String encrypt(byte[] plaintext, byte[] key) {
    if (key == null || key.length != KEY_LENGTH) {
      throw new SecretEnvelopeException();
    }
    byte[] nonce = randomProvider.randomBytes(NONCE_LENGTH);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));
      byte[] ciphertext = cipher.doFinal(plaintext);
      return versionTag + Base64.getEncoder().encodeToString(ByteUtils.concat(nonce, ciphertext));
    } catch (GeneralSecurityException e) {
      throw new SecretEnvelopeException(e);
    }
  }

  /**
   * Convenience for UTF-8 text secrets.
   *
   * @param plaintext the plaintext
   * @param key       the key
   * @return the envelope
   */
  public String encryptString(String plaintext, byte[] key) {
    return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
  }

  /**
   * Opens an envelope.
   *
   * @param envelope the envelope
   * @param key      32-byte AES key
   * @return the plaintext
   * @throws SecretEnvelopeException on any failure
   */
  public byte[] decrypt(String envelope, byte[] key) {
    if (envelope == null || key == null || key.length != KEY_LENGTH || !envelope.startsWith(versionTag)) {
      throw new SecretEnvelopeException();
    }
    try {
      byte[] payload = Base64.getDecoder().decode(envelope.substring(versionTag.length()));
      if (payload.length < NONCE_LENGTH) {
        throw new SecretEnvelopeException();
      }
      byte[] nonce = ByteUtils.slice(payload, 0, NONCE_LENGTH);
      byte[] ciphertext = ByteUtils.slice(payload, NONCE_LENGTH, payload.length);
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, nonce));
      return cipher.doFinal(ciphertext);
    } catch (IllegalArgumentException | GeneralSecurityException e) {
      throw new SecretEnvelopeException(e);
    }
  }

  /**
   * Opens an envelope holding UTF-8 text.
   *
   * @param envelope the envelope
   * @param key      the key
   * @return the string
   */
  public String decryptString(String envelope, byte[] key) {
    return new String(decrypt(envelope, key), StandardCharsets.UTF_8);
  }
}
