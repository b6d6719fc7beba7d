package com.codeheadsystems.gatekeeper.server.passkey;

import com.codeheadsystems.gatekeeper.server.model.PasskeyCredential;
import com.codeheadsystems.gatekeeper.server.store.PasskeyStore;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yubico.webauthn.CredentialRepository;
import com.yubico.webauthn.RegisteredCredential;
import com.yubico.webauthn.data.ByteArray;
import com.yubico.webauthn.data.PublicKeyCredentialDescriptor;
import com.yubico.webauthn.data.PublicKeyCredentialType;
import com.yubico.webauthn.data.exception.Base64UrlException;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only view of {@link PasskeyStore} and {@link UserStore} for the Yubico relying party. Writes
 * go through the managers, never through here.
 */
public class StoreCredentialRepository implements CredentialRepository {

  private static final Logger log = LoggerFactory.getLogger(StoreCredentialRepository.class);

  private final UserStore userStore;
  private final PasskeyStore passkeyStore;
  private final ObjectMapper objectMapper;

  public StoreCredentialRepository(UserStore userStore, PasskeyStore passkeyStore, ObjectMapper objectMapper) {
    this.userStore = userStore;
    this.passkeyStore = passkeyStore;
    this.objectMapper = objectMapper;
  }

  @Override
  public Set<PublicKeyCredentialDescriptor> getCredentialIdsForUsername(String username) {
    return userStore.findByUsername(username)
        .map(user -> passkeyStore.listByUserId(user.id()).stream()
            .map(PasskeyCredential::credentialId)
            .map(StoreCredentialRepository::decodeId)
            .flatMap(Optional::stream)
            .map(id -> PublicKeyCredentialDescriptor.builder()
                .id(id)
                .type(PublicKeyCredentialType.PUBLIC_KEY)
                .build())
            .collect(Collectors.toSet()))
        .orElse(Collections.emptySet());
  }

  @Override
  public Optional<ByteArray> getUserHandleForUsername(String username) {
    return userStore.findByUsername(username).map(user -> UserHandles.toHandle(user.id()));
  }

  @Override
  public Optional<String> getUsernameForUserHandle(ByteArray userHandle) {
    return UserHandles.fromHandle(userHandle)
        .flatMap(userStore::findById)
        .map(user -> user.username());
  }

  @Override
  public Optional<RegisteredCredential> lookup(ByteArray credentialId, ByteArray userHandle) {
    Optional<UUID> userId = UserHandles.fromHandle(userHandle);
    return passkeyStore.findByCredentialId(credentialId.getBase64Url())
        .filter(c -> userId.isPresent() && c.userId().equals(userId.get()))
        .flatMap(this::toRegistered);
  }

  @Override
  public Set<RegisteredCredential> lookupAll(ByteArray credentialId) {
    return passkeyStore.findByCredentialId(credentialId.getBase64Url())
        .flatMap(this::toRegistered)
        .map(Set::of)
        .orElse(Collections.emptySet());
  }

  private Optional<RegisteredCredential> toRegistered(PasskeyCredential credential) {
    try {
      AuthenticatorState state = objectMapper.readValue(credential.authenticatorState(), AuthenticatorState.class);
      return Optional.of(RegisteredCredential.builder()
          .credentialId(ByteArray.fromBase64Url(credential.credentialId()))
          .userHandle(UserHandles.toHandle(credential.userId()))
          .publicKeyCose(ByteArray.fromBase64Url(state.publicKeyCose()))
          .signatureCount(state.signatureCount())
          .build());
    } catch (JsonProcessingException | Base64UrlException e) {
      log.error("Stored passkey {} is unreadable", credential.credentialId(), e);
      return Optional.empty();
    }
  }

  private static Optional<ByteArray> decodeId(String credentialId) {
    try {
      return Optional.of(ByteArray.fromBase64Url(credentialId));
    } catch (Base64UrlException e) {
      log.error("Stored passkey id {} is not base64url", credentialId);
      return Optional.empty();
    }
  }
}
