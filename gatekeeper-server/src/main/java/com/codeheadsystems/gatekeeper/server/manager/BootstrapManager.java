package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.DuplicateKeyException;
import com.codeheadsystems.gatekeeper.server.store.TotpSecretStore;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-run setup. The first admin can only be created while no account exists at all, and only by a
 * caller presenting {@link GatekeeperConfig#bootstrapToken()} when one is configured. The admin gets no
 * password; the session issued here is meant for enrolling TOTP and passkeys.
 * <p>
 * <strong>Exception contract:</strong>
 * <ul>
 *   <li>{@code UNAUTHENTICATED}: wrong or missing bootstrap token</li>
 *   <li>{@code BAD_REQUEST}: an account already exists, or the username is blank</li>
 * </ul>
 */
@Singleton
public class BootstrapManager {

  private static final Logger log = LoggerFactory.getLogger(BootstrapManager.class);

  public static final String ADMIN_ROLE = "admin";

  private final UserStore userStore;
  private final TotpSecretStore totpSecretStore;
  private final SessionManager sessionManager;
  private final GatekeeperConfig config;
  private final Clock clock;

  @Inject
  public BootstrapManager(UserStore userStore,
                          TotpSecretStore totpSecretStore,
                          SessionManager sessionManager,
                          GatekeeperConfig config,
                          Clock clock) {
    this.userStore = userStore;
    this.totpSecretStore = totpSecretStore;
    this.sessionManager = sessionManager;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Where first-run setup stands.
   *
   * @return ready once an admin has TOTP enabled; needsTotp while accounts exist but no admin does
   */
  public BootstrapStatus status() {
    boolean anyUser = userStore.count() > 0;
    boolean adminTotp = userStore.findByRole(ADMIN_ROLE).stream()
        .anyMatch(admin -> !totpSecretStore.listEnabledByUserId(admin.id()).isEmpty());
    return new BootstrapStatus(anyUser && adminTotp, anyUser && !adminTotp);
  }

  /**
   * Creates the first admin and logs them in.
   *
   * @param token       the bootstrap token, ignored when none is configured
   * @param username    the admin username
   * @param displayName display name, defaults to the username
   * @return the admin's session
   */
  public synchronized IssuedSession createAdmin(String token, String username, String displayName) {
    checkToken(token);
    if (userStore.count() > 0) {
      throw AuthException.badRequest("bootstrap already completed");
    }
    if (username == null || username.isBlank()) {
      throw AuthException.badRequest("username is required");
    }
    String name = username.trim();
    Instant now = clock.instant();
    User admin = new User(UUID.randomUUID(), name,
        displayName == null || displayName.isBlank() ? name : displayName.trim(),
        ADMIN_ROLE, null, null, false, false, null, true, now);
    try {
      userStore.insert(admin);
    } catch (DuplicateKeyException e) {
      throw AuthException.badRequest("bootstrap already completed");
    }
    log.info("createAdmin(userId={}): first admin created", admin.id());
    return sessionManager.issue(admin.id());
  }

  private void checkToken(String token) {
    String expected = config.bootstrapToken();
    if (expected == null) {
      return;
    }
    if (token == null || !MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8))) {
      log.warn("createAdmin(): invalid bootstrap token");
      throw AuthException.unauthenticated("invalid bootstrap token");
    }
  }

  /**
   * First-run state.
   *
   * @param ready     an admin exists with TOTP enabled
   * @param needsTotp accounts exist but no admin has TOTP enabled
   */
  public record BootstrapStatus(boolean ready, boolean needsTotp) {
  }
}
