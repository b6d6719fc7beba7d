package com.codeheadsystems.gatekeeper.server.passkey;

import com.codeheadsystems.gatekeeper.server.config.RelyingPartySettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yubico.webauthn.AssertionRequest;
import com.yubico.webauthn.AssertionResult;
import com.yubico.webauthn.CredentialRepository;
import com.yubico.webauthn.FinishAssertionOptions;
import com.yubico.webauthn.FinishRegistrationOptions;
import com.yubico.webauthn.RegisteredCredential;
import com.yubico.webauthn.RegistrationResult;
import com.yubico.webauthn.RelyingParty;
import com.yubico.webauthn.StartAssertionOptions;
import com.yubico.webauthn.StartRegistrationOptions;
import com.yubico.webauthn.data.AuthenticatorAssertionResponse;
import com.yubico.webauthn.data.AuthenticatorAttestationResponse;
import com.yubico.webauthn.data.AuthenticatorSelectionCriteria;
import com.yubico.webauthn.data.ClientAssertionExtensionOutputs;
import com.yubico.webauthn.data.ClientRegistrationExtensionOutputs;
import com.yubico.webauthn.data.PublicKeyCredential;
import com.yubico.webauthn.data.PublicKeyCredentialCreationOptions;
import com.yubico.webauthn.data.RelyingPartyIdentity;
import com.yubico.webauthn.data.ResidentKeyRequirement;
import com.yubico.webauthn.data.UserIdentity;
import com.yubico.webauthn.data.UserVerificationRequirement;
import com.yubico.webauthn.exception.AssertionFailedException;
import com.yubico.webauthn.exception.RegistrationFailedException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PasskeyProtocol} backed by the Yubico {@link RelyingParty}.
 * <p>
 * Protocol state is the library's own JSON form of the creation options or assertion request.
 * The relying party validates signature counters, so a cloned authenticator surfaces as a
 * {@link PasskeyProtocolException} from {@link #finishAuthentication}.
 */
public class YubicoPasskeyProtocol implements PasskeyProtocol {

  private static final Logger log = LoggerFactory.getLogger(YubicoPasskeyProtocol.class);

  private final RelyingParty relyingParty;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Yubico passkey protocol.
   *
   * @param settings             the relying party identity
   * @param credentialRepository lookups for existing credentials
   * @param objectMapper         mapper for the authenticator state blob
   */
  public YubicoPasskeyProtocol(RelyingPartySettings settings,
                               CredentialRepository credentialRepository,
                               ObjectMapper objectMapper) {
    this.relyingParty = RelyingParty.builder()
        .identity(RelyingPartyIdentity.builder()
            .id(settings.id())
            .name(settings.name())
            .build())
        .credentialRepository(credentialRepository)
        .origins(settings.origins())
        .build();
    this.objectMapper = objectMapper;
    log.info("YubicoPasskeyProtocol(rpId={}, origins={})", settings.id(), settings.origins());
  }

  // ── Registration ─────────────────────────────────────────────────────────

  @Override
  public CeremonyChallenge beginRegistration(PasskeyUser user) {
    PublicKeyCredentialCreationOptions options = relyingParty.startRegistration(
        StartRegistrationOptions.builder()
            .user(UserIdentity.builder()
                .name(user.username())
                .displayName(user.displayName())
                .id(UserHandles.toHandle(user.userId()))
                .build())
            .authenticatorSelection(AuthenticatorSelectionCriteria.builder()
                .residentKey(ResidentKeyRequirement.PREFERRED)
                .userVerification(UserVerificationRequirement.PREFERRED)
                .build())
            .build());
    try {
      return new CeremonyChallenge(options.toCredentialsCreateJson(), options.toJson());
    } catch (JsonProcessingException e) {
      throw new PasskeyProtocolException("could not serialize registration options", e);
    }
  }

  @Override
  public NewCredential finishRegistration(String protocolState, String responseJson) {
    try {
      PublicKeyCredentialCreationOptions options = PublicKeyCredentialCreationOptions.fromJson(protocolState);
      PublicKeyCredential<AuthenticatorAttestationResponse, ClientRegistrationExtensionOutputs> pkc =
          PublicKeyCredential.parseRegistrationResponseJson(responseJson);
      RegistrationResult result = relyingParty.finishRegistration(FinishRegistrationOptions.builder()
          .request(options)
          .response(pkc)
          .build());
      AuthenticatorState state = new AuthenticatorState(
          result.getPublicKeyCose().getBase64Url(),
          result.getSignatureCount(),
          result.isBackupEligible(),
          result.isBackedUp());
      return new NewCredential(result.getKeyId().getId().getBase64Url(), objectMapper.writeValueAsString(state));
    } catch (RegistrationFailedException e) {
      throw new PasskeyProtocolException("registration rejected", e);
    } catch (IOException e) {
      throw new PasskeyProtocolException("malformed registration response", e);
    }
  }

  // ── Authentication ───────────────────────────────────────────────────────

  @Override
  public CeremonyChallenge beginAuthentication(String username) {
    AssertionRequest request = relyingParty.startAssertion(StartAssertionOptions.builder()
        .username(username)
        .userVerification(UserVerificationRequirement.PREFERRED)
        .build());
    try {
      return new CeremonyChallenge(request.toCredentialsGetJson(), request.toJson());
    } catch (JsonProcessingException e) {
      throw new PasskeyProtocolException("could not serialize assertion request", e);
    }
  }

  @Override
  public AssertionOutcome finishAuthentication(String protocolState, String responseJson) {
    try {
      AssertionRequest request = AssertionRequest.fromJson(protocolState);
      PublicKeyCredential<AuthenticatorAssertionResponse, ClientAssertionExtensionOutputs> pkc =
          PublicKeyCredential.parseAssertionResponseJson(responseJson);
      AssertionResult result = relyingParty.finishAssertion(FinishAssertionOptions.builder()
          .request(request)
          .response(pkc)
          .build());
      if (!result.isSuccess()) {
        throw new PasskeyProtocolException("assertion rejected");
      }
      RegisteredCredential stored = result.getCredential();
      AuthenticatorState updated = new AuthenticatorState(
          stored.getPublicKeyCose().getBase64Url(),
          result.getSignatureCount(),
          result.isBackupEligible(),
          result.isBackedUp());
      boolean advanced = result.getSignatureCount() > stored.getSignatureCount();
      return new AssertionOutcome(stored.getCredentialId().getBase64Url(),
          objectMapper.writeValueAsString(updated), advanced);
    } catch (AssertionFailedException e) {
      throw new PasskeyProtocolException("assertion rejected", e);
    } catch (IOException e) {
      throw new PasskeyProtocolException("malformed assertion response", e);
    }
  }
}
