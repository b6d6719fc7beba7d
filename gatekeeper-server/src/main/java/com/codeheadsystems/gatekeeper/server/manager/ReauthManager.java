package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.crypto.RandomProvider;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.error.AuthErrorKind;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.EphemeralStore;
import com.codeheadsystems.gatekeeper.server.store.PasskeyStore;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.time.Clock;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Step-up re-authentication before sensitive changes. A successful check yields a single-use grant
 * that expires after {@link GatekeeperConfig#reauthTtl()}.
 */
@Singleton
public class ReauthManager {

  private static final Logger log = LoggerFactory.getLogger(ReauthManager.class);
  private static final int TOKEN_BYTES = 32;

  private final UserStore userStore;
  private final PasskeyStore passkeyStore;
  private final PasswordManager passwordManager;
  private final TotpManager totpManager;
  private final RandomProvider randomProvider;
  private final GatekeeperConfig config;
  private final EphemeralStore<UUID> grants;

  @Inject
  public ReauthManager(UserStore userStore,
                       PasskeyStore passkeyStore,
                       PasswordManager passwordManager,
                       TotpManager totpManager,
                       RandomProvider randomProvider,
                       GatekeeperConfig config,
                       Clock clock) {
    this.userStore = userStore;
    this.passkeyStore = passkeyStore;
    this.passwordManager = passwordManager;
    this.totpManager = totpManager;
    this.randomProvider = randomProvider;
    this.config = config;
    this.grants = new EphemeralStore<>("reauth-grants", config.reauthTtl(), clock);
  }

  /**
   * Re-authenticates with the user's password.
   *
   * @param userId   the user id
   * @param password the password
   * @return the grant
   */
  public ReauthGrant withPassword(UUID userId, String password) {
    User user = activeUser(userId);
    if (!passwordManager.passwordLoginAllowed(user) || !passwordManager.matches(password, user.passwordHash())) {
      throw AuthException.unauthenticated("invalid password");
    }
    return grant(userId);
  }

  /**
   * Re-authenticates with a TOTP code.
   *
   * @param userId the user id
   * @param code   the code
   * @return the grant
   */
  public ReauthGrant withTotp(UUID userId, String code) {
    activeUser(userId);
    boolean valid;
    try {
      valid = totpManager.verifyLogin(userId, code);
    } catch (AuthException e) {
      if (e.kind() == AuthErrorKind.NOT_FOUND) {
        throw AuthException.unauthenticated("no TOTP enrolled");
      }
      throw e;
    }
    if (!valid) {
      throw AuthException.unauthenticated("invalid TOTP code");
    }
    return grant(userId);
  }

  /**
   * Issues a grant after a factor has been verified elsewhere, e.g. a passkey assertion.
   *
   * @param userId the user id
   * @return the grant
   */
  public ReauthGrant grant(UUID userId) {
    String token = randomProvider.urlSafeToken(TOKEN_BYTES);
    grants.put(token, userId);
    log.debug("grant(userId={})", userId);
    return new ReauthGrant(token, config.reauthTtl().toSeconds());
  }

  /**
   * Whether the user has any factor to re-authenticate with.
   *
   * @param userId the user id
   * @return true if password login, a passkey or enabled TOTP exists
   */
  public boolean needsReauth(UUID userId) {
    User user = userStore.findById(userId).orElse(null);
    if (user == null) {
      return false;
    }
    return passwordManager.passwordLoginAllowed(user)
        || !passkeyStore.listByUserId(userId).isEmpty()
        || totpManager.hasEnabled(userId);
  }

  /**
   * Consumes a grant before a sensitive operation. Users without any factor pass through.
   *
   * @param userId the user id
   * @param token  the grant token, may be null
   * @throws AuthException UNAUTHENTICATED if a grant is required and missing, expired or foreign
   */
  public void require(UUID userId, String token) {
    if (!needsReauth(userId)) {
      return;
    }
    if (token == null || token.isBlank()) {
      throw AuthException.unauthenticated("reauthentication required");
    }
    UUID owner = grants.take(token)
        .orElseThrow(() -> AuthException.unauthenticated("reauthentication expired"));
    if (!owner.equals(userId)) {
      throw AuthException.unauthenticated("reauthentication belongs to another user");
    }
  }

  private User activeUser(UUID userId) {
    return userStore.findById(userId)
        .filter(User::active)
        .orElseThrow(() -> AuthException.unauthenticated("user not found or disabled"));
  }

  /**
   * A re-authentication grant.
   *
   * @param token     the single-use token
   * @param expiresIn seconds until it expires
   */
  public record ReauthGrant(String token, long expiresIn) {
  }
}
