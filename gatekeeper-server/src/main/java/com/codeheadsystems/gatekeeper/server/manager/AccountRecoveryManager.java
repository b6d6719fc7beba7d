package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.mail.MailDeliveryException;
import com.codeheadsystems.gatekeeper.server.mail.Mailer;
import com.codeheadsystems.gatekeeper.server.model.DeviceKind;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.ResetDelivery;
import com.codeheadsystems.gatekeeper.server.model.TimeBoxedToken;
import com.codeheadsystems.gatekeeper.server.model.TokenPurpose;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.DeviceStore;
import com.codeheadsystems.gatekeeper.server.store.PasskeyStore;
import com.codeheadsystems.gatekeeper.server.store.TotpSecretStore;
import com.codeheadsystems.gatekeeper.server.store.TransactionManager;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.time.Duration;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administrator-initiated resets of a user's TOTP or passkeys.
 * <p>
 * Consuming a reset removes every credential of the reset kind and every session of the user in the
 * same transaction that marks the token used, then logs the user in afresh so they can enroll again.
 */
@Singleton
public class AccountRecoveryManager {

  private static final Logger log = LoggerFactory.getLogger(AccountRecoveryManager.class);

  private final UserStore userStore;
  private final TimeBoxedTokenManager tokenManager;
  private final SessionManager sessionManager;
  private final PasskeyStore passkeyStore;
  private final TotpSecretStore totpSecretStore;
  private final DeviceStore deviceStore;
  private final TransactionManager transactionManager;
  private final Mailer mailer;
  private final GatekeeperConfig config;

  @Inject
  public AccountRecoveryManager(UserStore userStore,
                                TimeBoxedTokenManager tokenManager,
                                SessionManager sessionManager,
                                PasskeyStore passkeyStore,
                                TotpSecretStore totpSecretStore,
                                DeviceStore deviceStore,
                                TransactionManager transactionManager,
                                Mailer mailer,
                                GatekeeperConfig config) {
    this.userStore = userStore;
    this.tokenManager = tokenManager;
    this.sessionManager = sessionManager;
    this.passkeyStore = passkeyStore;
    this.totpSecretStore = totpSecretStore;
    this.deviceStore = deviceStore;
    this.transactionManager = transactionManager;
    this.mailer = mailer;
    this.config = config;
  }

  /**
   * Mails a TOTP or passkey reset link to the user.
   *
   * @param username the username
   * @param purpose  {@code totp} or {@code passkey}
   */
  public void sendReset(String username, String purpose) {
    if (config.resetDelivery() != ResetDelivery.EMAIL) {
      throw AuthException.badRequest("reset by email is disabled");
    }
    TokenPurpose resetPurpose = credentialPurpose(purpose);
    User user = userStore.findByUsername(username)
        .orElseThrow(() -> AuthException.notFound("user not found"));
    if (user.email() == null || user.email().isBlank()) {
      throw AuthException.badRequest("user has no email");
    }
    String token = tokenManager.issueReset(resetPurpose, user.id(), config.resetTtl());
    try {
      mailer.send(user.email(), "Reset your " + resetPurpose.tag(),
          "Use this link to reset your " + resetPurpose.tag() + ": " + config.link("/reset", token));
    } catch (MailDeliveryException e) {
      throw AuthException.internal("could not send reset", e);
    }
    log.info("sendReset(userId={}, purpose={})", user.id(), resetPurpose.tag());
  }

  /**
   * Issues a reset token for an administrator to hand over out of band. Password codes are
   * redeemed through {@link PasswordManager#confirmReset}.
   *
   * @param username the username
   * @param purpose  {@code password}, {@code totp} or {@code passkey}
   * @return the raw token
   */
  public String issueResetCode(String username, String purpose) {
    if (config.resetDelivery() != ResetDelivery.CODE) {
      throw AuthException.badRequest("reset codes are disabled");
    }
    TokenPurpose resetPurpose = TokenPurpose.fromTag(purpose)
        .filter(p -> p != TokenPurpose.INVITE)
        .orElseThrow(() -> AuthException.badRequest("invalid reset purpose"));
    User user = userStore.findByUsername(username)
        .orElseThrow(() -> AuthException.notFound("user not found"));
    Duration ttl = resetPurpose == TokenPurpose.PASSWORD ? config.passwordResetTtl() : config.resetTtl();
    String token = tokenManager.issueReset(resetPurpose, user.id(), ttl);
    log.info("issueResetCode(userId={}, purpose={})", user.id(), resetPurpose.tag());
    return token;
  }

  /**
   * Reports whether a reset token may still be consumed.
   *
   * @param rawToken the token
   * @return the status
   */
  public ResetStatus resetStatus(String rawToken) {
    return tokenManager.find(rawToken)
        .filter(t -> t.purpose() != TokenPurpose.INVITE)
        .map(t -> new ResetStatus(true, t.purpose().tag()))
        .orElseGet(() -> new ResetStatus(false, null));
  }

  /**
   * Consumes a TOTP or passkey reset.
   *
   * @param rawToken the token
   * @return the consumption, including a fresh session
   */
  public ResetConsumption consumeReset(String rawToken) {
    TimeBoxedToken token = tokenManager.validate(rawToken, null);
    if (token.purpose() != TokenPurpose.TOTP && token.purpose() != TokenPurpose.PASSKEY) {
      throw AuthException.badRequest("invalid reset purpose");
    }
    UUID userId = token.userId();
    User user = userStore.findById(userId)
        .filter(User::active)
        .orElseThrow(() -> AuthException.unauthenticated("user not found or disabled"));
    int revoked = transactionManager.inTransaction(() -> {
      tokenManager.markUsed(token);
      if (token.purpose() == TokenPurpose.TOTP) {
        totpSecretStore.deleteByUserId(userId);
        deviceStore.deleteByUserIdAndKind(userId, DeviceKind.TOTP);
      } else {
        passkeyStore.deleteByUserId(userId);
        deviceStore.deleteByUserIdAndKind(userId, DeviceKind.PASSKEY);
      }
      return sessionManager.revokeAll(userId);
    });
    log.info("consumeReset(userId={}, purpose={}): {} session(s) revoked", user.id(), token.purpose().tag(), revoked);
    IssuedSession session = sessionManager.issue(userId);
    return new ResetConsumption(userId, token.purpose().tag(), session);
  }

  private static TokenPurpose credentialPurpose(String purpose) {
    return TokenPurpose.fromTag(purpose)
        .filter(p -> p == TokenPurpose.TOTP || p == TokenPurpose.PASSKEY)
        .orElseThrow(() -> AuthException.badRequest("invalid reset purpose"));
  }

  /**
   * Reset status.
   *
   * @param valid   whether the token can be consumed
   * @param purpose the purpose tag, null when invalid
   */
  public record ResetStatus(boolean valid, String purpose) {
  }

  /**
   * Result of consuming a reset.
   *
   * @param userId  the user id
   * @param purpose the purpose tag
   * @param session the new session
   */
  public record ResetConsumption(UUID userId, String purpose, IssuedSession session) {
  }
}
