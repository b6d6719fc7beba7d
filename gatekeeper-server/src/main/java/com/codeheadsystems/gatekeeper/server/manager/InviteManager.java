package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.mail.MailDeliveryException;
import com.codeheadsystems.gatekeeper.server.mail.Mailer;
import com.codeheadsystems.gatekeeper.server.model.InviteProfile;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.ResetDelivery;
import com.codeheadsystems.gatekeeper.server.model.TimeBoxedToken;
import com.codeheadsystems.gatekeeper.server.model.TokenPurpose;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.DuplicateKeyException;
import com.codeheadsystems.gatekeeper.server.store.TransactionManager;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Account invites. An invite carries the prospective profile; accepting it creates the account and
 * logs the new user in so they can register a passkey.
 */
@Singleton
public class InviteManager {

  private static final Logger log = LoggerFactory.getLogger(InviteManager.class);

  private final UserStore userStore;
  private final TimeBoxedTokenManager tokenManager;
  private final SessionManager sessionManager;
  private final TransactionManager transactionManager;
  private final Mailer mailer;
  private final GatekeeperConfig config;
  private final Clock clock;

  @Inject
  public InviteManager(UserStore userStore,
                       TimeBoxedTokenManager tokenManager,
                       SessionManager sessionManager,
                       TransactionManager transactionManager,
                       Mailer mailer,
                       GatekeeperConfig config,
                       Clock clock) {
    this.userStore = userStore;
    this.tokenManager = tokenManager;
    this.sessionManager = sessionManager;
    this.transactionManager = transactionManager;
    this.mailer = mailer;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Creates an invite. In email mode the link is mailed and nothing is returned; in code mode the
   * raw token is returned for the administrator to hand over.
   *
   * @param profile the prospective account
   * @return the raw token in code mode, empty in email mode
   */
  public Optional<String> createInvite(InviteProfile profile) {
    if (profile == null || blank(profile.username()) || blank(profile.role())) {
      throw AuthException.validation("username and role are required");
    }
    if (userStore.findByUsername(profile.username()).isPresent()) {
      throw AuthException.conflict("username already exists");
    }
    boolean byEmail = config.resetDelivery() == ResetDelivery.EMAIL;
    if (byEmail && blank(profile.email())) {
      throw AuthException.validation("email is required");
    }
    String token = tokenManager.issueInvite(profile, config.inviteTtl());
    log.info("createInvite(username={}, role={})", profile.username(), profile.role());
    if (!byEmail) {
      return Optional.of(token);
    }
    try {
      mailer.send(profile.email(), "You're invited",
          "Use this link to create your account: " + config.link("/invite", token));
    } catch (MailDeliveryException e) {
      throw AuthException.internal("could not send invite", e);
    }
    return Optional.empty();
  }

  /**
   * Reports whether an invite may still be accepted.
   *
   * @param rawToken the token
   * @return the status
   */
  public InviteStatus inviteStatus(String rawToken) {
    return tokenManager.find(rawToken)
        .filter(t -> t.purpose() == TokenPurpose.INVITE)
        .map(t -> new InviteStatus(true, t.profile(), t.expiresAt()))
        .orElseGet(() -> new InviteStatus(false, null, null));
  }

  /**
   * Accepts an invite, creating the account.
   *
   * @param rawToken the token
   * @return the acceptance, including a session for the new user
   */
  public InviteAcceptance acceptInvite(String rawToken) {
    TimeBoxedToken token = tokenManager.validate(rawToken, TokenPurpose.INVITE);
    InviteProfile profile = token.profile();
    if (userStore.findByUsername(profile.username()).isPresent()) {
      throw AuthException.conflict("username already exists");
    }
    Instant now = clock.instant();
    User user = new User(UUID.randomUUID(), profile.username(),
        blank(profile.displayName()) ? profile.username() : profile.displayName(),
        profile.role(), profile.email(), null, false, false, null, true, now);
    try {
      transactionManager.inTransaction(() -> {
        userStore.insert(user);
        tokenManager.markUsed(token);
      });
    } catch (DuplicateKeyException e) {
      throw AuthException.conflict("username already exists");
    }
    log.info("acceptInvite(userId={}, username={})", user.id(), user.username());
    IssuedSession session = sessionManager.issue(user.id());
    return new InviteAcceptance(user.id(), user.username(), user.role(), session);
  }

  private static boolean blank(String s) {
    return s == null || s.isBlank();
  }

  /**
   * Invite status.
   *
   * @param valid     whether the invite can be accepted
   * @param profile   the profile, null when invalid
   * @param expiresAt the expiry, null when invalid
   */
  public record InviteStatus(boolean valid, InviteProfile profile, Instant expiresAt) {
  }

  /**
   * Result of accepting an invite.
   *
   * @param userId   the new user id
   * @param username the username
   * @param role     the role
   * @param session  the session
   */
  public record InviteAcceptance(UUID userId, String username, String role, IssuedSession session) {
  }
}
