package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.crypto.MalformedHashException;
import com.codeheadsystems.gatekeeper.crypto.PasswordHasher;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.mail.MailDeliveryException;
import com.codeheadsystems.gatekeeper.server.mail.Mailer;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.PasswordPolicy;
import com.codeheadsystems.gatekeeper.server.model.ResetDelivery;
import com.codeheadsystems.gatekeeper.server.model.TimeBoxedToken;
import com.codeheadsystems.gatekeeper.server.model.TokenPurpose;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.TransactionManager;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Password login, change and reset. Password login is only open to roles listed in
 * {@link GatekeeperConfig#passwordLoginRoles()} and to users with password login allowed.
 */
@Singleton
public class PasswordManager {

  private static final Logger log = LoggerFactory.getLogger(PasswordManager.class);

  private final UserStore userStore;
  private final SessionManager sessionManager;
  private final TimeBoxedTokenManager tokenManager;
  private final TransactionManager transactionManager;
  private final PasswordHasher passwordHasher;
  private final Supplier<PasswordPolicy> policySupplier;
  private final Mailer mailer;
  private final GatekeeperConfig config;
  private final Clock clock;

  @Inject
  public PasswordManager(UserStore userStore,
                         SessionManager sessionManager,
                         TimeBoxedTokenManager tokenManager,
                         TransactionManager transactionManager,
                         PasswordHasher passwordHasher,
                         Supplier<PasswordPolicy> policySupplier,
                         Mailer mailer,
                         GatekeeperConfig config,
                         Clock clock) {
    this.userStore = userStore;
    this.sessionManager = sessionManager;
    this.tokenManager = tokenManager;
    this.transactionManager = transactionManager;
    this.passwordHasher = passwordHasher;
    this.policySupplier = policySupplier;
    this.mailer = mailer;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Logs in with a password.
   *
   * @param username the username
   * @param password the password
   * @return the session
   * @throws AuthException NOT_FOUND for an unknown user, UNAUTHENTICATED for anything else
   */
  public IssuedSession login(String username, String password) {
    User user = userStore.findByUsername(username)
        .orElseThrow(() -> AuthException.notFound("user not found"));
    if (!user.active()) {
      throw AuthException.unauthenticated("user disabled");
    }
    if (!passwordLoginAllowed(user)) {
      throw AuthException.unauthenticated("password login not allowed");
    }
    if (!matches(password, user.passwordHash())) {
      log.info("login(userId={}): wrong password", user.id());
      throw AuthException.unauthenticated("invalid password");
    }
    return sessionManager.issue(user.id());
  }

  /**
   * Whether the user may log in with a password right now.
   *
   * @param user the user
   * @return true if role, flag and hash all allow it
   */
  public boolean passwordLoginAllowed(User user) {
    return config.passwordLoginRoles().contains(user.role()) && user.allowPasswordLogin() && user.hasPassword();
  }

  /**
   * Changes the password of an authenticated user.
   *
   * @param userId          the user id
   * @param currentPassword the current password
   * @param newPassword     the new password
   */
  public void changePassword(UUID userId, String currentPassword, String newPassword) {
    User user = userStore.findById(userId)
        .orElseThrow(() -> AuthException.notFound("user not found"));
    if (!user.hasPassword() || !matches(currentPassword, user.passwordHash())) {
      throw AuthException.unauthenticated("invalid password");
    }
    policySupplier.get().validate(newPassword);
    userStore.update(user.withPassword(passwordHasher.hash(newPassword), clock.instant()));
    log.info("changePassword(userId={})", userId);
  }

  /**
   * Sets a password chosen by an administrator. The user keeps password login but is flagged to change
   * the password, which {@link SessionManager#validate} exposes on the returned user. Existing sessions
   * are revoked.
   *
   * @param userId            the user id
   * @param temporaryPassword the assigned password
   * @throws AuthException NOT_FOUND for an unknown user, FORBIDDEN if the role may not use passwords
   */
  public void assignTemporaryPassword(UUID userId, String temporaryPassword) {
    policySupplier.get().validate(temporaryPassword);
    User user = userStore.findById(userId)
        .orElseThrow(() -> AuthException.notFound("user not found"));
    if (!config.passwordLoginRoles().contains(user.role())) {
      throw AuthException.forbidden("password login not available for role");
    }
    String hash = passwordHasher.hash(temporaryPassword);
    Instant now = clock.instant();
    transactionManager.inTransaction(() -> {
      userStore.update(user.withTemporaryPassword(hash, now));
      sessionManager.revokeAll(user.id());
    });
    log.info("assignTemporaryPassword(userId={})", userId);
  }

  /**
   * Mails a password reset link.
   *
   * @param username the username
   */
  public void requestReset(String username) {
    if (config.resetDelivery() != ResetDelivery.EMAIL) {
      throw AuthException.badRequest("password reset by email is disabled");
    }
    User user = userStore.findByUsername(username)
        .orElseThrow(() -> AuthException.notFound("user not found"));
    if (!config.passwordLoginRoles().contains(user.role())) {
      throw AuthException.forbidden("password login not available for role");
    }
    if (user.email() == null || user.email().isBlank()) {
      throw AuthException.badRequest("user has no email");
    }
    String token = tokenManager.issueReset(TokenPurpose.PASSWORD, user.id(), config.passwordResetTtl());
    try {
      mailer.send(user.email(), "Password reset",
          "Use this link to set a new password: " + config.link("/password-reset", token));
    } catch (MailDeliveryException e) {
      throw AuthException.internal("could not send password reset", e);
    }
    log.info("requestReset(userId={})", user.id());
  }

  /**
   * Sets a new password from a reset token. The token is consumed, the hash stored and every
   * session of the user revoked in one transaction.
   *
   * @param rawToken    the token
   * @param newPassword the new password
   * @return the user id
   */
  public UUID confirmReset(String rawToken, String newPassword) {
    policySupplier.get().validate(newPassword);
    String hash = passwordHasher.hash(newPassword);
    TimeBoxedToken token = tokenManager.validate(rawToken, TokenPurpose.PASSWORD);
    User user = userStore.findById(token.userId())
        .orElseThrow(() -> AuthException.notFound("user not found"));
    Instant now = clock.instant();
    transactionManager.inTransaction(() -> {
      tokenManager.markUsed(token);
      userStore.update(user.withPassword(hash, now));
      sessionManager.revokeAll(user.id());
    });
    log.info("confirmReset(userId={})", user.id());
    return user.id();
  }

  /**
   * Verifies a password without side effects.
   *
   * @param password the candidate
   * @param stored   the stored hash
   * @return true if it matches
   */
  boolean matches(String password, String stored) {
    if (password == null || stored == null) {
      return false;
    }
    try {
      return passwordHasher.verify(password, stored);
    } catch (MalformedHashException e) {
      throw AuthException.internal("stored password hash is corrupt", e);
    }
  }
}
