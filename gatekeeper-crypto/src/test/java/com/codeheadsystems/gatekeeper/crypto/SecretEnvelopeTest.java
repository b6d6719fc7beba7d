package com.codeheadsystems.gatekeeper.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SecretEnvelopeTest {

  private RandomProvider randomProvider;
  private SecretEnvelope envelope;
  private byte[] key;

  @BeforeEach
  void setUp() {
    randomProvider = new RandomProvider();
    envelope = new SecretEnvelope(randomProvider);
    key = randomProvider.randomBytes(32);
  }

  @Test
  void encryptDecrypt_roundTrip() {
    byte[] plaintext = "JBSWY3DPEHPK3PXP".getBytes(StandardCharsets.US_ASCII);
    String sealed = envelope.encrypt(plaintext, key);

    assertThat(sealed).startsWith("SECv1:");
    assertThat(envelope.decrypt(sealed, key)).isEqualTo(plaintext);
  }

  @Test
  void encryptDecrypt_emptyPlaintext() {
    String sealed = envelope.encrypt(new byte[0], key);
    assertThat(envelope.decrypt(sealed, key)).isEmpty();
  }

  @Test
  void encrypt_samePlaintextTwice_differentEnvelopes() {
    byte[] plaintext = "same".getBytes(StandardCharsets.UTF_8);
    assertThat(envelope.encrypt(plaintext, key)).isNotEqualTo(envelope.encrypt(plaintext, key));
  }

  @Test
  void encrypt_layoutIsNonceCiphertextAndTag() {
    String sealed = envelope.encrypt(new byte[5], key);
    byte[] payload = Base64.getDecoder().decode(sealed.substring("SECv1:".length()));
    assertThat(payload).hasSize(12 + 5 + 16);
  }

  @Test
  void decrypt_wrongKey_throws() {
    String sealed = envelope.encryptString("secret", key);
    byte[] otherKey = randomProvider.randomBytes(32);

    assertThatThrownBy(() -> envelope.decrypt(sealed, otherKey))
        .isInstanceOf(SecretEnvelopeException.class)
        .hasMessage("secret envelope failure");
  }

  @Test
  void decrypt_missingPrefix_throwsSameError() {
    String sealed = envelope.encryptString("secret", key);
    String stripped = sealed.substring("SECv1:".length());

    assertThatThrownBy(() -> envelope.decrypt(stripped, key))
        .isInstanceOf(SecretEnvelopeException.class)
        .hasMessage("secret envelope failure");
  }

  @Test
  void decrypt_truncatedPayload_throwsSameError() {
    String shortPayload = "SECv1:" + Base64.getEncoder().encodeToString(new byte[7]);

    assertThatThrownBy(() -> envelope.decrypt(shortPayload, key))
        .isInstanceOf(SecretEnvelopeException.class)
        .hasMessage("secret envelope failure");
  }

  @Test
  void decrypt_badBase64_throwsSameError() {
    assertThatThrownBy(() -> envelope.decrypt("SECv1:!!not-base64!!", key))
        .isInstanceOf(SecretEnvelopeException.class)
        .hasMessage("secret envelope failure");
  }

  @Test
  void decrypt_tamperedCiphertext_throws() {
    String sealed = envelope.encryptString("secret", key);
    byte[] payload = Base64.getDecoder().decode(sealed.substring(6));
    payload[payload.length - 1] ^= 0x01;
    String tampered = "SECv1:" + Base64.getEncoder().encodeToString(payload);

    assertThatThrownBy(() -> envelope.decrypt(tampered, key))
        .isInstanceOf(SecretEnvelopeException.class);
  }

  @Test
  void encrypt_wrongKeyLength_throws() {
    assertThatThrownBy(() -> envelope.encrypt(new byte[1], new byte[16]))
        .isInstanceOf(SecretEnvelopeException.class);
  }

  @Test
  void decrypt_otherVersionTag_rejected() {
    SecretEnvelope transportEnvelope = new SecretEnvelope("TLSKEYv1:", randomProvider);
    String sealed = transportEnvelope.encryptString("pem", key);

    assertThat(transportEnvelope.decryptString(sealed, key)).isEqualTo("pem");
    assertThatThrownBy(() -> envelope.decrypt(sealed, key))
        .isInstanceOf(SecretEnvelopeException.class);
  }
}
