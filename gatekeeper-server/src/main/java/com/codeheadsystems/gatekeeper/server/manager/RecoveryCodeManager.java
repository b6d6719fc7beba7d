package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.crypto.MalformedHashException;
import com.codeheadsystems.gatekeeper.crypto.PasswordHasher;
import com.codeheadsystems.gatekeeper.crypto.RandomProvider;
import com.codeheadsystems.gatekeeper.crypto.TokenHasher;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.RecoveryCode;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.RecoveryCodeStore;
import com.codeheadsystems.gatekeeper.server.store.TransactionManager;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batches of one-time recovery codes. Each code is 12 random bytes in unpadded base64url, stored as
 * an Argon2id hash. Regenerating replaces the whole batch in one transaction.
 */
@Singleton
public class RecoveryCodeManager {

  private static final Logger log = LoggerFactory.getLogger(RecoveryCodeManager.class);
  private static final int CODE_BYTES = 12;

  private final RecoveryCodeStore recoveryCodeStore;
  private final UserStore userStore;
  private final SessionManager sessionManager;
  private final TransactionManager transactionManager;
  private final PasswordHasher passwordHasher;
  private final TokenHasher tokenHasher;
  private final RandomProvider randomProvider;
  private final int batchSize;
  private final Clock clock;

  @Inject
  public RecoveryCodeManager(RecoveryCodeStore recoveryCodeStore,
                             UserStore userStore,
                             SessionManager sessionManager,
                             TransactionManager transactionManager,
                             PasswordHasher passwordHasher,
                             TokenHasher tokenHasher,
                             RandomProvider randomProvider,
                             GatekeeperConfig config,
                             Clock clock) {
    this.recoveryCodeStore = recoveryCodeStore;
    this.userStore = userStore;
    this.sessionManager = sessionManager;
    this.transactionManager = transactionManager;
    this.passwordHasher = passwordHasher;
    this.tokenHasher = tokenHasher;
    this.randomProvider = randomProvider;
    this.batchSize = config.recoveryBatchSize();
    this.clock = clock;
  }

  /**
   * Replaces the user's codes with a batch of the configured size.
   *
   * @param userId the user id
   * @return the raw codes, for one-time display
   */
  public List<String> generate(UUID userId) {
    return generate(userId, batchSize);
  }

  /**
   * Replaces the user's codes with a new batch. Hashing happens before the transaction starts.
   *
   * @param userId the user id
   * @param count  the number of codes
   * @return the raw codes, for one-time display
   */
  public List<String> generate(UUID userId, int count) {
    if (count < 1) {
      throw AuthException.validation("count must be positive");
    }
    Set<String> codes = new LinkedHashSet<>();
    while (codes.size() < count) {
      codes.add(randomProvider.urlSafeToken(CODE_BYTES));
    }
    Instant now = clock.instant();
    List<RecoveryCode> rows = new ArrayList<>(count);
    for (String code : codes) {
      rows.add(new RecoveryCode(UUID.randomUUID(), userId, passwordHasher.hash(code), now, null));
    }
    int replaced = transactionManager.inTransaction(() -> {
      int deleted = recoveryCodeStore.deleteByUserId(userId);
      rows.forEach(recoveryCodeStore::insert);
      return deleted;
    });
    log.info("generate(userId={}): {} code(s) issued, {} replaced", userId, count, replaced);
    return List.copyOf(codes);
  }

  /**
   * Consumes the first unused code that matches.
   *
   * @param userId    the user id
   * @param candidate the candidate code
   * @return true if a code matched and this call consumed it
   */
  public boolean verifyAndConsume(UUID userId, String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return false;
    }
    String trimmed = candidate.trim();
    for (RecoveryCode row : recoveryCodeStore.listUnusedByUserId(userId)) {
      boolean matches;
      try {
        matches = passwordHasher.verify(trimmed, row.codeHash());
      } catch (MalformedHashException e) {
        throw AuthException.internal("stored recovery code hash is corrupt", e);
      }
      if (matches && recoveryCodeStore.markUsed(row.id(), clock.instant())) {
        log.info("verifyAndConsume(userId={}, label={}): consumed", userId, tokenHasher.auditLabel(userId, trimmed));
        return true;
      }
    }
    return false;
  }

  /**
   * Logs in with username and recovery code.
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
    if (!verifyAndConsume(user.id(), code)) {
      throw AuthException.unauthenticated("invalid recovery code");
    }
    return sessionManager.issue(user.id());
  }

  /**
   * Remaining unused codes.
   *
   * @param userId the user id
   * @return the count
   */
  public int remaining(UUID userId) {
    return recoveryCodeStore.listUnusedByUserId(userId).size();
  }
}
