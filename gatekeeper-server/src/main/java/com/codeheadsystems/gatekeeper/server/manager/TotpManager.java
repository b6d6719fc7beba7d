package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.crypto.SecretEnvelope;
import com.codeheadsystems.gatekeeper.crypto.SecretEnvelopeException;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.error.AuthErrorKind;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.model.Device;
import com.codeheadsystems.gatekeeper.server.model.DeviceKind;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.TotpSecret;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.DeviceStore;
import com.codeheadsystems.gatekeeper.server.store.TotpSecretStore;
import com.codeheadsystems.gatekeeper.server.store.TransactionManager;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import dev.samstevens.totp.code.CodeVerifier;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.DefaultCodeVerifier;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.qr.QrData;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TOTP enrollment and verification. Codes are SHA-1, six digits, 30-second step, and the steps
 * either side of the current one are accepted.
 * <p>
 * Per user: not enrolled, then a pending row from {@link #startEnrollment}, then enabled by
 * {@link #finishEnrollment}. Enabling a row disables any row enabled earlier, so at most one is
 * used for login.
 * <p>
 * <strong>Exception contract:</strong>
 * <ul>
 *   <li>{@code BAD_REQUEST}: no account name for the provisioning URI</li>
 *   <li>{@code NOT_FOUND}: no such enrollment, or no enabled TOTP for the user</li>
 *   <li>{@code FORBIDDEN}: the enrollment belongs to another user</li>
 *   <li>{@code UNAUTHENTICATED}: wrong code</li>
 *   <li>{@code INTERNAL}: a stored secret could not be decrypted</li>
 * </ul>
 */
@Singleton
public class TotpManager {

  private static final Logger log = LoggerFactory.getLogger(TotpManager.class);

  private static final int DIGITS = 6;
  private static final int PERIOD_SECONDS = 30;
  private static final int ALLOWED_SKEW_STEPS = 1;
  private static final Pattern CODE_FORMAT = Pattern.compile("\\d{" + DIGITS + "}");

  private final TotpSecretStore totpSecretStore;
  private final DeviceStore deviceStore;
  private final UserStore userStore;
  private final SessionManager sessionManager;
  private final TransactionManager transactionManager;
  private final SecretEnvelope secretEnvelope;
  private final GatekeeperConfig config;
  private final Clock clock;
  private final SecretGenerator secretGenerator = new DefaultSecretGenerator();
  private final CodeVerifier codeVerifier;

  @Inject
  public TotpManager(TotpSecretStore totpSecretStore,
                     DeviceStore deviceStore,
                     UserStore userStore,
                     SessionManager sessionManager,
                     TransactionManager transactionManager,
                     SecretEnvelope secretEnvelope,
                     GatekeeperConfig config,
                     Clock clock) {
    this.totpSecretStore = totpSecretStore;
    this.deviceStore = deviceStore;
    this.userStore = userStore;
    this.sessionManager = sessionManager;
    this.transactionManager = transactionManager;
    this.secretEnvelope = secretEnvelope;
    this.config = config;
    this.clock = clock;
    DefaultCodeVerifier verifier = new DefaultCodeVerifier(
        new DefaultCodeGenerator(HashingAlgorithm.SHA1, DIGITS),
        () -> clock.instant().getEpochSecond());
    verifier.setTimePeriod(PERIOD_SECONDS);
    verifier.setAllowedTimePeriodDiscrepancy(ALLOWED_SKEW_STEPS);
    this.codeVerifier = verifier;
  }

  // ── Enrollment ───────────────────────────────────────────────────────────

  /**
   * Creates a pending TOTP row and returns the provisioning URI. The base32 secret only ever leaves
   * this method inside the URI.
   *
   * @param userId      the user id
   * @param accountName the account label shown in the authenticator app
   * @return the enrollment
   * @throws AuthException BAD_REQUEST if the account name is missing
   */
  public Enrollment startEnrollment(UUID userId, String accountName) {
    if (accountName == null || accountName.isBlank()) {
      throw AuthException.badRequest("account name is required");
    }
    String secret = secretGenerator.generate();
    TotpSecret row = new TotpSecret(UUID.randomUUID(), userId,
        seal(secret), false, clock.instant(), null);
    totpSecretStore.insert(row);
    QrData data = new QrData.Builder()
        .label(accountName)
        .secret(secret)
        .issuer(config.totpIssuer())
        .algorithm(HashingAlgorithm.SHA1)
        .digits(DIGITS)
        .period(PERIOD_SECONDS)
        .build();
    log.debug("startEnrollment(userId={}, enrollmentId={})", userId, row.id());
    return new Enrollment(row.id(), data.getUri());
  }

  /**
   * Verifies the first code from a pending row and enables it.
   *
   * @param callerId     the authenticated caller
   * @param enrollmentId the enrollment id
   * @param code         the code
   * @param deviceLabel  optional device label; when present a TOTP device row is recorded
   */
  public void finishEnrollment(UUID callerId, UUID enrollmentId, String code, String deviceLabel) {
    TotpSecret row = totpSecretStore.findById(enrollmentId)
        .orElseThrow(() -> AuthException.notFound("enrollment not found"));
    if (!row.userId().equals(callerId)) {
      throw AuthException.forbidden("enrollment belongs to another user");
    }
    if (!verifyCode(open(row), code)) {
      throw AuthException.unauthenticated("invalid TOTP code");
    }
    Instant now = clock.instant();
    transactionManager.inTransaction(() -> {
      for (TotpSecret previous : totpSecretStore.listEnabledByUserId(callerId)) {
        if (!previous.id().equals(row.id())) {
          totpSecretStore.update(previous.disable());
        }
      }
      totpSecretStore.update(row.enable(now));
      if (deviceLabel != null && !deviceLabel.isBlank()) {
        deviceStore.insert(new Device(UUID.randomUUID(), callerId, DeviceKind.TOTP, deviceLabel.trim(), null,
            now, null));
      }
    });
    log.info("finishEnrollment(userId={}): TOTP enabled", callerId);
  }

  // ── Verification ─────────────────────────────────────────────────────────

  /**
   * Checks a code against the user's enabled secret.
   *
   * @param userId the user id
   * @param code   the code
   * @return true if the code is valid for the current step or an adjacent one
   * @throws AuthException NOT_FOUND if the user has no enabled TOTP
   */
  public boolean verifyLogin(UUID userId, String code) {
    TotpSecret row = enabledSecret(userId)
        .orElseThrow(() -> AuthException.notFound("no TOTP enrolled"));
    return verifyCode(open(row), code);
  }

  /**
   * Logs in with username and TOTP code.
   *
   * @param username the username
   * @param code     the code
   * @return the session
   * @throws AuthException UNAUTHENTICATED on any failure
   */
  public IssuedSession login(String username, String code) {
    User user = userStore.findByUsername(username)
        .filter(User::active)
        .orElseThrow(() -> AuthException.unauthenticated("unknown or disabled user"));
    boolean valid;
    try {
      valid = verifyLogin(user.id(), code);
    } catch (AuthException e) {
      if (e.kind() == AuthErrorKind.NOT_FOUND) {
        throw AuthException.unauthenticated("no TOTP enrolled");
      }
      throw e;
    }
    if (!valid) {
      log.info("login(userId={}): TOTP rejected", user.id());
      throw AuthException.unauthenticated("invalid TOTP code");
    }
    Instant now = clock.instant();
    deviceStore.listByUserId(user.id()).stream()
        .filter(d -> d.kind() == DeviceKind.TOTP)
        .forEach(d -> deviceStore.update(d.touch(now)));
    return sessionManager.issue(user.id());
  }

  /**
   * Whether the user has an enabled TOTP secret.
   *
   * @param userId the user id
   * @return true if enabled
   */
  public boolean hasEnabled(UUID userId) {
    return !totpSecretStore.listEnabledByUserId(userId).isEmpty();
  }

  /**
   * Checks a code against a base32 secret. Malformed codes are rejected before any HMAC work; the
   * comparison itself is constant-time.
   *
   * @param base32Secret the secret
   * @param code         the code
   * @return true if valid within the allowed skew
   */
  public boolean verifyCode(String base32Secret, String code) {
    if (code == null || !CODE_FORMAT.matcher(code).matches()) {
      return false;
    }
    return codeVerifier.isValidCode(base32Secret, code);
  }

  /**
   * A fresh base32 secret.
   *
   * @return the secret
   */
  public String newSecret() {
    return secretGenerator.generate();
  }

  private Optional<TotpSecret> enabledSecret(UUID userId) {
    List<TotpSecret> enabled = totpSecretStore.listEnabledByUserId(userId);
    if (enabled.size() > 1) {
      log.warn("User {} has {} enabled TOTP secrets; using the most recently verified", userId, enabled.size());
    }
    return enabled.stream().max(Comparator.comparing(
        (TotpSecret s) -> s.verifiedAt() == null ? s.createdAt() : s.verifiedAt()));
  }

  private String seal(String secret) {
    try {
      return secretEnvelope.encryptString(secret, config.secretKey());
    } catch (SecretEnvelopeException e) {
      throw AuthException.internal("could not encrypt TOTP secret", e);
    }
  }

  private String open(TotpSecret row) {
    try {
      return secretEnvelope.decryptString(row.secretEnvelope(), config.secretKey());
    } catch (SecretEnvelopeException e) {
      log.error("TOTP secret {} could not be decrypted", row.id());
      throw AuthException.internal("could not decrypt TOTP secret", e);
    }
  }

  /**
   * Result of starting an enrollment.
   *
   * @param enrollmentId id to pass to {@link #finishEnrollment}
   * @param otpauthUrl   provisioning URI for one-time display
   */
  public record Enrollment(UUID enrollmentId, String otpauthUrl) {
  }
}
