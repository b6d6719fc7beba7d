package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.crypto.RandomProvider;
import com.codeheadsystems.gatekeeper.crypto.TokenHasher;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.model.InviteProfile;
import com.codeheadsystems.gatekeeper.server.model.TimeBoxedToken;
import com.codeheadsystems.gatekeeper.server.model.TokenPurpose;
import com.codeheadsystems.gatekeeper.server.store.TimeBoxedTokenStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and consumes single-use invite and reset tokens.
 * <p>
 * A raw token is 40 alphanumeric characters, returned once by {@code issue} and never again
 * retrievable. Expired rows are never deleted here; they simply stop validating.
 * <p>
 * {@link #markUsed(TimeBoxedToken)} is the atomic conditional step. Callers that pair consumption
 * with other writes invoke it inside the same transaction as those writes.
 */
@Singleton
public class TimeBoxedTokenManager {

  private static final Logger log = LoggerFactory.getLogger(TimeBoxedTokenManager.class);
  private static final int TOKEN_LENGTH = 40;

  private final TimeBoxedTokenStore tokenStore;
  private final TokenHasher tokenHasher;
  private final RandomProvider randomProvider;
  private final Clock clock;

  @Inject
  public TimeBoxedTokenManager(TimeBoxedTokenStore tokenStore,
                               TokenHasher tokenHasher,
                               RandomProvider randomProvider,
                               Clock clock) {
    this.tokenStore = tokenStore;
    this.tokenHasher = tokenHasher;
    this.randomProvider = randomProvider;
    this.clock = clock;
  }

  /**
   * Issues a reset token targeting an existing user.
   *
   * @param purpose the purpose
   * @param userId  the target user
   * @param ttl     the lifetime
   * @return the raw token
   */
  public String issueReset(TokenPurpose purpose, UUID userId, Duration ttl) {
    if (purpose == TokenPurpose.INVITE) {
      throw new IllegalArgumentException("invites carry a profile, not a user");
    }
    return issue(purpose, userId, null, ttl);
  }

  /**
   * Issues an invite token carrying the prospective account.
   *
   * @param profile the profile
   * @param ttl     the lifetime
   * @return the raw token
   */
  public String issueInvite(InviteProfile profile, Duration ttl) {
    return issue(TokenPurpose.INVITE, null, profile, ttl);
  }

  private String issue(TokenPurpose purpose, UUID userId, InviteProfile profile, Duration ttl) {
    String rawToken = randomProvider.alphanumeric(TOKEN_LENGTH);
    Instant now = clock.instant();
    tokenStore.insert(new TimeBoxedToken(UUID.randomUUID(), tokenHasher.hash(rawToken), purpose, userId, profile,
        now, now.plus(ttl), null));
    log.debug("issue(purpose={}, userId={})", purpose.tag(), userId);
    return rawToken;
  }

  /**
   * Looks up an unused token without consuming it.
   *
   * @param rawToken the raw token
   * @return the token if present, unused and unexpired
   */
  public Optional<TimeBoxedToken> find(String rawToken) {
    if (rawToken == null || rawToken.isEmpty()) {
      return Optional.empty();
    }
    return tokenStore.findUnusedByHash(tokenHasher.hash(rawToken))
        .filter(t -> !t.isExpired(clock.instant()));
  }

  /**
   * Validates a token.
   *
   * @param rawToken        the raw token
   * @param expectedPurpose required purpose, or null to accept any
   * @return the token record
   * @throws AuthException NOT_FOUND if absent or already used, BAD_REQUEST if expired or the purpose differs
   */
  public TimeBoxedToken validate(String rawToken, TokenPurpose expectedPurpose) {
    if (rawToken == null || rawToken.isEmpty()) {
      throw AuthException.notFound("token expired or already used");
    }
    TimeBoxedToken token = tokenStore.findUnusedByHash(tokenHasher.hash(rawToken))
        .orElseThrow(() -> AuthException.notFound("token expired or already used"));
    if (token.isExpired(clock.instant())) {
      throw AuthException.badRequest("token expired or already used");
    }
    if (expectedPurpose != null && token.purpose() != expectedPurpose) {
      throw AuthException.badRequest("invalid token purpose");
    }
    return token;
  }

  /**
   * Conditionally marks a validated token used.
   *
   * @param token the token
   * @throws AuthException BAD_REQUEST if another request consumed it first
   */
  public void markUsed(TimeBoxedToken token) {
    if (!tokenStore.markUsed(token.id(), clock.instant())) {
      throw AuthException.badRequest("token expired or already used");
    }
  }

  /**
   * Validates and consumes a token in one step.
   *
   * @param rawToken        the raw token
   * @param expectedPurpose required purpose, or null
   * @return the consumed token
   */
  public TimeBoxedToken consume(String rawToken, TokenPurpose expectedPurpose) {
    TimeBoxedToken token = validate(rawToken, expectedPurpose);
    markUsed(token);
    log.info("consume(purpose={}, userId={})", token.purpose().tag(), token.userId());
    return token;
  }
}
