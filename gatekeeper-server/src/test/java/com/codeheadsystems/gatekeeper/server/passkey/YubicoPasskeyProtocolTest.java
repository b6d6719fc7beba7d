package com.codeheadsystems.gatekeeper.server.passkey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.gatekeeper.server.config.RelyingPartySettings;
import com.codeheadsystems.gatekeeper.server.model.PasskeyCredential;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.InMemoryPasskeyStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryUserStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class YubicoPasskeyProtocolTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private InMemoryUserStore userStore;
  private InMemoryPasskeyStore passkeyStore;
  private YubicoPasskeyProtocol protocol;
  private User alice;

  @BeforeEach
  void setUp() throws Exception {
    userStore = new InMemoryUserStore();
    passkeyStore = new InMemoryPasskeyStore();
    protocol = new YubicoPasskeyProtocol(
        new RelyingPartySettings("example.com", "Example", Set.of("https://example.com")),
        new StoreCredentialRepository(userStore, passkeyStore, objectMapper),
        objectMapper);
    alice = new User(UUID.randomUUID(), "alice", "Alice A", "student", "alice@example.com", null, false, false,
        null, true, Instant.now());
    userStore.insert(alice);
    passkeyStore.insert(new PasskeyCredential("AQIDBA", alice.id(),
        objectMapper.writeValueAsString(new AuthenticatorState("AQID", 0, false, false)), Instant.now(), null));
  }

  @Test
  void beginRegistration_producesCreateOptionsExcludingExistingCredentials() throws Exception {
    CeremonyChallenge challenge = protocol.beginRegistration(new PasskeyUser(alice.id(), "alice", "Alice A"));

    JsonNode publicKey = objectMapper.readTree(challenge.publicKeyJson()).get("publicKey");
    assertThat(publicKey.get("rp").get("id").asText()).isEqualTo("example.com");
    assertThat(publicKey.get("user").get("name").asText()).isEqualTo("alice");
    assertThat(publicKey.get("challenge").asText()).isNotBlank();
    assertThat(publicKey.get("excludeCredentials")).hasSize(1);
    assertThat(publicKey.get("excludeCredentials").get(0).get("id").asText()).isEqualTo("AQIDBA");
    assertThat(challenge.protocolState()).isNotEqualTo(challenge.publicKeyJson());
  }

  @Test
  void beginRegistration_challengesAreFresh() {
    PasskeyUser user = new PasskeyUser(alice.id(), "alice", "Alice A");

    assertThat(protocol.beginRegistration(user).protocolState())
        .isNotEqualTo(protocol.beginRegistration(user).protocolState());
  }

  @Test
  void beginAuthentication_allowsRegisteredCredentials() throws Exception {
    CeremonyChallenge challenge = protocol.beginAuthentication("alice");

    JsonNode publicKey = objectMapper.readTree(challenge.publicKeyJson()).get("publicKey");
    assertThat(publicKey.get("rpId").asText()).isEqualTo("example.com");
    assertThat(publicKey.get("allowCredentials")).hasSize(1);
  }

  @Test
  void finishRegistration_garbageResponse_protocolException() {
    CeremonyChallenge challenge = protocol.beginRegistration(new PasskeyUser(alice.id(), "alice", "Alice A"));

    assertThatThrownBy(() -> protocol.finishRegistration(challenge.protocolState(), "{not json"))
        .isInstanceOf(PasskeyProtocolException.class);
  }

  @Test
  void finishAuthentication_garbageResponse_protocolException() {
    CeremonyChallenge challenge = protocol.beginAuthentication("alice");

    assertThatThrownBy(() -> protocol.finishAuthentication(challenge.protocolState(), "[]"))
        .isInstanceOf(PasskeyProtocolException.class);
  }

  @Test
  void finishRegistration_corruptState_protocolException() {
    assertThatThrownBy(() -> protocol.finishRegistration("not-state", "{}"))
        .isInstanceOf(PasskeyProtocolException.class);
  }
}
