package com.codeheadsystems.gatekeeper.crypto;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TokenHasherTest {

  private final TokenHasher tokenHasher = new TokenHasher();

  @Test
  void hash_knownVector() {
    assertThat(tokenHasher.hash("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @Test
  void hash_isDeterministic() {
    assertThat(tokenHasher.hash("token")).isEqualTo(tokenHasher.hash("token"));
    assertThat(tokenHasher.hash("token")).isNotEqualTo(tokenHasher.hash("token2"));
  }

  @Test
  void auditLabel_dependsOnUserAndCode() {
    UUID user = UUID.randomUUID();
    String label = tokenHasher.auditLabel(user, "code");

    assertThat(label).hasSize(64);
    assertThat(tokenHasher.auditLabel(user, "code")).isEqualTo(label);
    assertThat(tokenHasher.auditLabel(UUID.randomUUID(), "code")).isNotEqualTo(label);
  }
}
