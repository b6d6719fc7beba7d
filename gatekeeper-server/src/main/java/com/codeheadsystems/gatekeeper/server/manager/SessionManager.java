package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.crypto.RandomProvider;
import com.codeheadsystems.gatekeeper.crypto.TokenHasher;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.Session;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.SessionStore;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and validates opaque session tokens after any successful authentication.
 * <p>
 * A token is 32 random bytes in unpadded base64url. Only its SHA-256 hex is stored in the
 * {@link SessionStore}, so a leaked store cannot be replayed and revocation is a row delete.
 */
@Singleton
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
  private static final int TOKEN_BYTES = 32;

  private final SessionStore sessionStore;
  private final UserStore userStore;
  private final TokenHasher tokenHasher;
  private final RandomProvider randomProvider;
  private final Duration ttl;
  private final Clock clock;

  /**
   * Instantiates a new Session manager.
   *
   * @param sessionStore   the session store
   * @param userStore      the user store
   * @param tokenHasher    the token hasher
   * @param randomProvider the random provider
   * @param config         the config
   * @param clock          the clock
   */
  @Inject
  public SessionManager(SessionStore sessionStore,
                        UserStore userStore,
                        TokenHasher tokenHasher,
                        RandomProvider randomProvider,
                        GatekeeperConfig config,
                        Clock clock) {
    this.sessionStore = sessionStore;
    this.userStore = userStore;
    this.tokenHasher = tokenHasher;
    this.randomProvider = randomProvider;
    this.ttl = config.sessionTtl();
    this.clock = clock;
  }

  /**
   * Issues a session with the configured TTL.
   *
   * @param userId the user id
   * @return the issued session
   */
  public IssuedSession issue(UUID userId) {
    return issue(userId, ttl);
  }

  /**
   * Issues a session.
   *
   * @param userId the user id
   * @param ttl    the lifetime
   * @return the issued session, raw token included
   */
  public IssuedSession issue(UUID userId, Duration ttl) {
    String rawToken = randomProvider.urlSafeToken(TOKEN_BYTES);
    Instant now = clock.instant();
    Instant expiresAt = now.plus(ttl);
    sessionStore.insert(new Session(tokenHasher.hash(rawToken), userId, now, expiresAt, now));
    log.debug("issue(userId={}, expiresAt={})", userId, expiresAt);
    return new IssuedSession(rawToken, expiresAt, userId);
  }

  /**
   * Resolves a bearer token to its active user.
   *
   * @param rawToken the raw token
   * @return the user
   * @throws AuthException UNAUTHENTICATED if the token is unknown or expired, or the user is missing or disabled
   */
  public User validate(String rawToken) {
    if (rawToken == null || rawToken.isEmpty()) {
      throw AuthException.unauthenticated("missing session");
    }
    Session session = sessionStore.findByTokenHash(tokenHasher.hash(rawToken))
        .orElseThrow(() -> AuthException.unauthenticated("invalid session"));
    if (session.expiresAt().isBefore(clock.instant())) {
      throw AuthException.unauthenticated("session expired");
    }
    User user = userStore.findById(session.userId())
        .orElseThrow(() -> AuthException.unauthenticated("user not found"));
    if (!user.active()) {
      throw AuthException.unauthenticated("user disabled");
    }
    return user;
  }

  /**
   * Records activity on a session.
   *
   * @param rawToken the raw token
   */
  public void touch(String rawToken) {
    sessionStore.touch(tokenHasher.hash(rawToken), clock.instant());
  }

  /**
   * Logs out a single session. Unknown tokens are ignored.
   *
   * @param rawToken the raw token
   */
  public void revoke(String rawToken) {
    sessionStore.deleteByTokenHash(tokenHasher.hash(rawToken));
    log.debug("revoke()");
  }

  /**
   * Deletes every session of the user.
   *
   * @param userId the user id
   * @return the number of sessions revoked
   */
  public int revokeAll(UUID userId) {
    int revoked = sessionStore.deleteByUserId(userId);
    log.info("revokeAll(userId={}): {} session(s)", userId, revoked);
    return revoked;
  }
}
