package com.codeheadsystems.gatekeeper.server;

import com.codeheadsystems.gatekeeper.crypto.Argon2Config;
import com.codeheadsystems.gatekeeper.crypto.PasswordHasher;
import com.codeheadsystems.gatekeeper.crypto.RandomProvider;
import com.codeheadsystems.gatekeeper.crypto.SecretEnvelope;
import com.codeheadsystems.gatekeeper.crypto.TokenHasher;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.mail.Mailer;
import com.codeheadsystems.gatekeeper.server.manager.AccountRecoveryManager;
import com.codeheadsystems.gatekeeper.server.manager.BootstrapManager;
import com.codeheadsystems.gatekeeper.server.manager.DeviceManager;
import com.codeheadsystems.gatekeeper.server.manager.InviteManager;
import com.codeheadsystems.gatekeeper.server.manager.LoginOptionsManager;
import com.codeheadsystems.gatekeeper.server.manager.PasskeyCeremonyManager;
import com.codeheadsystems.gatekeeper.server.manager.PasswordManager;
import com.codeheadsystems.gatekeeper.server.manager.ReauthManager;
import com.codeheadsystems.gatekeeper.server.manager.RecoveryCodeManager;
import com.codeheadsystems.gatekeeper.server.manager.SessionManager;
import com.codeheadsystems.gatekeeper.server.manager.TimeBoxedTokenManager;
import com.codeheadsystems.gatekeeper.server.manager.TotpManager;
import com.codeheadsystems.gatekeeper.server.model.PasswordPolicy;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.passkey.PasskeyProtocol;
import com.codeheadsystems.gatekeeper.server.passkey.PendingCeremony;
import com.codeheadsystems.gatekeeper.server.store.EphemeralStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryDeviceStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryPasskeyStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryRecoveryCodeStore;
import com.codeheadsystems.gatekeeper.server.store.InMemorySessionStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryTimeBoxedTokenStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryTotpSecretStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryTransactionManager;
import com.codeheadsystems.gatekeeper.server.store.InMemoryUserStore;
import java.time.Instant;
import java.util.UUID;

/**
 * Wires every manager over in-memory stores, cheap Argon2 parameters and a {@link MutableClock}.
 */
public class GatekeeperFixture {

  public static final Instant START = Instant.parse("2026-01-15T10:00:00Z");

  public final MutableClock clock = new MutableClock(START);
  public final RandomProvider randomProvider = new RandomProvider();
  public final TokenHasher tokenHasher = new TokenHasher();
  public final PasswordHasher passwordHasher = new PasswordHasher(Argon2Config.forTesting(), randomProvider);
  public final SecretEnvelope secretEnvelope = new SecretEnvelope(randomProvider);
  public final GatekeeperConfig config;

  public final InMemoryUserStore userStore = new InMemoryUserStore();
  public final InMemorySessionStore sessionStore = new InMemorySessionStore();
  public final InMemoryPasskeyStore passkeyStore = new InMemoryPasskeyStore();
  public final InMemoryTotpSecretStore totpSecretStore = new InMemoryTotpSecretStore();
  public final InMemoryRecoveryCodeStore recoveryCodeStore = new InMemoryRecoveryCodeStore();
  public final InMemoryTimeBoxedTokenStore tokenStore = new InMemoryTimeBoxedTokenStore();
  public final InMemoryDeviceStore deviceStore = new InMemoryDeviceStore();
  public final InMemoryTransactionManager transactionManager = new InMemoryTransactionManager();
  public final EphemeralStore<PendingCeremony> ceremonies;

  public final SessionManager sessionManager;
  public final TimeBoxedTokenManager tokenManager;
  public final TotpManager totpManager;
  public final RecoveryCodeManager recoveryCodeManager;
  public final PasswordManager passwordManager;
  public final InviteManager inviteManager;
  public final AccountRecoveryManager accountRecoveryManager;
  public final ReauthManager reauthManager;
  public final DeviceManager deviceManager;
  public final LoginOptionsManager loginOptionsManager;
  public final PasskeyCeremonyManager passkeyCeremonyManager;
  public final BootstrapManager bootstrapManager;

  public GatekeeperFixture(Mailer mailer, PasskeyProtocol protocol) {
    this(GatekeeperConfig.defaults(new RandomProvider().randomBytes(32), "https://gatekeeper.test"), mailer, protocol);
  }

  public GatekeeperFixture(GatekeeperConfig config, Mailer mailer, PasskeyProtocol protocol) {
    this.config = config.validate();
    this.ceremonies = new EphemeralStore<>("ceremonies", config.ceremonyTtl(), clock);
    sessionManager = new SessionManager(sessionStore, userStore, tokenHasher, randomProvider, config, clock);
    tokenManager = new TimeBoxedTokenManager(tokenStore, tokenHasher, randomProvider, clock);
    totpManager = new TotpManager(totpSecretStore, deviceStore, userStore, sessionManager, transactionManager,
        secretEnvelope, config, clock);
    recoveryCodeManager = new RecoveryCodeManager(recoveryCodeStore, userStore, sessionManager, transactionManager,
        passwordHasher, tokenHasher, randomProvider, config, clock);
    passwordManager = new PasswordManager(userStore, sessionManager, tokenManager, transactionManager,
        passwordHasher, () -> PasswordPolicy.DEFAULT, mailer, config, clock);
    inviteManager = new InviteManager(userStore, tokenManager, sessionManager, transactionManager, mailer, config,
        clock);
    accountRecoveryManager = new AccountRecoveryManager(userStore, tokenManager, sessionManager, passkeyStore,
        totpSecretStore, deviceStore, transactionManager, mailer, config);
    reauthManager = new ReauthManager(userStore, passkeyStore, passwordManager, totpManager, randomProvider, config,
        clock);
    deviceManager = new DeviceManager(deviceStore, passkeyStore, totpSecretStore, transactionManager);
    loginOptionsManager = new LoginOptionsManager(userStore, passwordManager);
    passkeyCeremonyManager = new PasskeyCeremonyManager(protocol, passkeyStore, deviceStore, userStore,
        sessionManager, reauthManager, transactionManager, ceremonies, clock);
    bootstrapManager = new BootstrapManager(userStore, totpSecretStore, sessionManager, config, clock);
  }

  /**
   * Inserts an active user without a password.
   */
  public User user(String username, String role) {
    User user = new User(UUID.randomUUID(), username, username, role, username + "@example.com", null, false,
        false, null, true, clock.instant());
    userStore.insert(user);
    return user;
  }

  /**
   * Inserts an active user with a password and password login allowed.
   */
  public User userWithPassword(String username, String role, String password) {
    User user = new User(UUID.randomUUID(), username, username, role, username + "@example.com",
        passwordHasher.hash(password), true, false, clock.instant(), true, clock.instant());
    userStore.insert(user);
    return user;
  }
}
