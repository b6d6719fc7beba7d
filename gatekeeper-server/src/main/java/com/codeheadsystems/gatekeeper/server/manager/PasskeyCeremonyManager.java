package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.model.Device;
import com.codeheadsystems.gatekeeper.server.model.DeviceKind;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.PasskeyCredential;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.passkey.AssertionOutcome;
import com.codeheadsystems.gatekeeper.server.passkey.CeremonyChallenge;
import com.codeheadsystems.gatekeeper.server.passkey.CeremonyType;
import com.codeheadsystems.gatekeeper.server.passkey.NewCredential;
import com.codeheadsystems.gatekeeper.server.passkey.PasskeyProtocol;
import com.codeheadsystems.gatekeeper.server.passkey.PasskeyProtocolException;
import com.codeheadsystems.gatekeeper.server.passkey.PasskeyUser;
import com.codeheadsystems.gatekeeper.server.passkey.PendingCeremony;
import com.codeheadsystems.gatekeeper.server.store.DeviceStore;
import com.codeheadsystems.gatekeeper.server.store.DuplicateKeyException;
import com.codeheadsystems.gatekeeper.server.store.EphemeralStore;
import com.codeheadsystems.gatekeeper.server.store.PasskeyStore;
import com.codeheadsystems.gatekeeper.server.store.TransactionManager;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Passkey registration and authentication ceremonies.
 * <p>
 * Each {@code start} stores a {@link PendingCeremony} in an {@link EphemeralStore} under a fresh
 * random session id; the matching {@code finish} takes it out again, so every session id is
 * consumed at most once even when two finishes race. Pending ceremonies expire lazily after the
 * configured ceremony TTL.
 * <p>
 * <strong>Exception contract</strong> ({@link AuthException} kinds):
 * <ul>
 *   <li>{@code BAD_REQUEST}: unknown, expired or already consumed session id; no passkeys registered</li>
 *   <li>{@code NOT_FOUND}: unknown user</li>
 *   <li>{@code FORBIDDEN}: disabled user, or a registration finished by another user</li>
 *   <li>{@code CONFLICT}: credential id already registered</li>
 *   <li>{@code UNAUTHENTICATED}: the client response was rejected</li>
 *   <li>{@code INTERNAL}: the protocol could not produce a challenge</li>
 * </ul>
 * {@link IllegalStateException} is thrown when too many ceremonies are pending.
 */
@Singleton
public class PasskeyCeremonyManager {

  private static final Logger log = LoggerFactory.getLogger(PasskeyCeremonyManager.class);
  private static final String DEFAULT_DEVICE_LABEL = "Passkey";

  private final PasskeyProtocol protocol;
  private final PasskeyStore passkeyStore;
  private final DeviceStore deviceStore;
  private final UserStore userStore;
  private final SessionManager sessionManager;
  private final ReauthManager reauthManager;
  private final TransactionManager transactionManager;
  private final EphemeralStore<PendingCeremony> pending;
  private final Clock clock;

  @Inject
  public PasskeyCeremonyManager(PasskeyProtocol protocol,
                                PasskeyStore passkeyStore,
                                DeviceStore deviceStore,
                                UserStore userStore,
                                SessionManager sessionManager,
                                ReauthManager reauthManager,
                                TransactionManager transactionManager,
                                EphemeralStore<PendingCeremony> pending,
                                Clock clock) {
    this.protocol = protocol;
    this.passkeyStore = passkeyStore;
    this.deviceStore = deviceStore;
    this.userStore = userStore;
    this.sessionManager = sessionManager;
    this.reauthManager = reauthManager;
    this.transactionManager = transactionManager;
    this.pending = pending;
    this.clock = clock;
  }

  /**
   * Drops every pending ceremony. Call on application shutdown.
   */
  public void shutdown() {
    pending.clear();
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Starts registering a new passkey for an authenticated user.
   *
   * @param userId the caller
   * @return the session id and challenge
   */
  public CeremonyStart registrationStart(UUID userId) {
    log.debug("registrationStart(userId={})", userId);
    User user = userStore.findById(userId)
        .orElseThrow(() -> AuthException.notFound("user not found"));
    if (!user.active()) {
      throw AuthException.forbidden("user disabled");
    }
    CeremonyChallenge challenge = begin(() -> protocol.beginRegistration(
        new PasskeyUser(user.id(), user.username(), user.displayName())));
    return remember(CeremonyType.REGISTRATION, user.id(), challenge);
  }

  /**
   * Finishes a registration.
   *
   * @param callerId     the caller, must own the pending ceremony
   * @param sessionId    the session id from {@link #registrationStart}
   * @param responseJson the client's attestation
   * @param label        optional device label
   * @return the new credential id
   */
  public String registrationFinish(UUID callerId, String sessionId, String responseJson, String label) {
    log.debug("registrationFinish(userId={})", callerId);
    PendingCeremony ceremony = take(sessionId, CeremonyType.REGISTRATION);
    if (!ceremony.userId().equals(callerId)) {
      throw AuthException.forbidden("ceremony belongs to another user");
    }
    NewCredential credential = finish(() -> protocol.finishRegistration(ceremony.protocolState(), responseJson));
    if (passkeyStore.findByCredentialId(credential.credentialId()).isPresent()) {
      throw AuthException.conflict("credential already registered");
    }
    Instant now = clock.instant();
    String deviceLabel = label == null || label.isBlank() ? DEFAULT_DEVICE_LABEL : label.trim();
    try {
      transactionManager.inTransaction(() -> {
        passkeyStore.insert(new PasskeyCredential(credential.credentialId(), callerId,
            credential.authenticatorState(), now, null));
        deviceStore.insert(new Device(UUID.randomUUID(), callerId, DeviceKind.PASSKEY, deviceLabel,
            credential.credentialId(), now, null));
      });
    } catch (DuplicateKeyException e) {
      throw AuthException.conflict("credential already registered");
    }
    log.info("registrationFinish(userId={}): passkey registered", callerId);
    return credential.credentialId();
  }

  // ── Authentication ───────────────────────────────────────────────────────

  /**
   * Starts a passkey login.
   *
   * @param username the username
   * @return the session id and challenge
   */
  public CeremonyStart authenticationStart(String username) {
    log.debug("authenticationStart()");
    User user = userStore.findByUsername(username)
        .orElseThrow(() -> AuthException.notFound("user not found"));
    if (!user.active()) {
      throw AuthException.forbidden("user disabled");
    }
    if (passkeyStore.listByUserId(user.id()).isEmpty()) {
      throw AuthException.badRequest("no passkeys registered");
    }
    CeremonyChallenge challenge = begin(() -> protocol.beginAuthentication(user.username()));
    return remember(CeremonyType.AUTHENTICATION, user.id(), challenge);
  }

  /**
   * Finishes a passkey login and issues a session.
   *
   * @param sessionId    the session id from {@link #authenticationStart}
   * @param responseJson the client's assertion
   * @return the session
   */
  public IssuedSession authenticationFinish(String sessionId, String responseJson) {
    log.debug("authenticationFinish()");
    PendingCeremony ceremony = take(sessionId, CeremonyType.AUTHENTICATION);
    UUID userId = verifyAssertion(ceremony, responseJson);
    User user = userStore.findById(userId)
        .filter(User::active)
        .orElseThrow(() -> AuthException.unauthenticated("user not found or disabled"));
    return sessionManager.issue(user.id());
  }

  // ── Re-authentication ────────────────────────────────────────────────────

  /**
   * Starts a passkey step-up for an authenticated user.
   *
   * @param userId the caller
   * @return the session id and challenge
   */
  public CeremonyStart reauthenticationStart(UUID userId) {
    User user = userStore.findById(userId)
        .filter(User::active)
        .orElseThrow(() -> AuthException.unauthenticated("user not found or disabled"));
    if (passkeyStore.listByUserId(userId).isEmpty()) {
      throw AuthException.badRequest("no passkeys registered");
    }
    CeremonyChallenge challenge = begin(() -> protocol.beginAuthentication(user.username()));
    return remember(CeremonyType.REAUTHENTICATION, userId, challenge);
  }

  /**
   * Finishes a passkey step-up.
   *
   * @param callerId     the caller, must own the pending ceremony
   * @param sessionId    the session id
   * @param responseJson the client's assertion
   * @return the grant
   */
  public ReauthManager.ReauthGrant reauthenticationFinish(UUID callerId, String sessionId, String responseJson) {
    PendingCeremony ceremony = take(sessionId, CeremonyType.REAUTHENTICATION);
    if (!ceremony.userId().equals(callerId)) {
      throw AuthException.forbidden("ceremony belongs to another user");
    }
    verifyAssertion(ceremony, responseJson);
    return reauthManager.grant(callerId);
  }

  // ── Internals ────────────────────────────────────────────────────────────

  private UUID verifyAssertion(PendingCeremony ceremony, String responseJson) {
    AssertionOutcome outcome = finish(() -> protocol.finishAuthentication(ceremony.protocolState(), responseJson));
    PasskeyCredential credential = passkeyStore.findByCredentialId(outcome.credentialId())
        .orElseThrow(() -> AuthException.unauthenticated("credential not found"));
    if (!credential.userId().equals(ceremony.userId())) {
      throw AuthException.unauthenticated("credential belongs to another user");
    }
    Instant now = clock.instant();
    String state = outcome.counterAdvanced() ? outcome.authenticatorState() : credential.authenticatorState();
    Optional<Device> device = deviceStore.findByCredentialId(credential.credentialId());
    transactionManager.inTransaction(() -> {
      passkeyStore.update(credential.withState(state, now));
      if (device.isPresent()) {
        deviceStore.update(device.get().touch(now));
      } else {
        deviceStore.insert(new Device(UUID.randomUUID(), credential.userId(), DeviceKind.PASSKEY,
            DEFAULT_DEVICE_LABEL, credential.credentialId(), now, now));
      }
    });
    return credential.userId();
  }

  private CeremonyStart remember(CeremonyType type, UUID userId, CeremonyChallenge challenge) {
    String sessionId = UUID.randomUUID().toString();
    pending.put(sessionId, new PendingCeremony(type, userId, challenge.protocolState(), clock.instant()));
    return new CeremonyStart(sessionId, challenge.publicKeyJson());
  }

  private PendingCeremony take(String sessionId, CeremonyType expected) {
    if (sessionId == null) {
      throw AuthException.badRequest("invalid or expired session");
    }
    PendingCeremony ceremony = pending.take(sessionId)
        .orElseThrow(() -> AuthException.badRequest("invalid or expired session"));
    if (ceremony.type() != expected) {
      throw AuthException.badRequest("invalid or expired session");
    }
    return ceremony;
  }

  private static CeremonyChallenge begin(Supplier<CeremonyChallenge> call) {
    try {
      return call.get();
    } catch (PasskeyProtocolException e) {
      throw AuthException.internal("could not start passkey ceremony", e);
    }
  }

  private static <T> T finish(Supplier<T> call) {
    try {
      return call.get();
    } catch (PasskeyProtocolException e) {
      log.info("Passkey response rejected: {}", e.getMessage());
      throw AuthException.unauthenticated("passkey verification failed");
    }
  }

  /**
   * Output of a ceremony start.
   *
   * @param sessionId     id to pass to the matching finish
   * @param publicKeyJson options for the browser
   */
  public record CeremonyStart(String sessionId, String publicKeyJson) {
  }
}
