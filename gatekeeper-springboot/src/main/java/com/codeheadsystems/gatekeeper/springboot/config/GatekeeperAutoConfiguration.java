package com.codeheadsystems.gatekeeper.springboot.config;

import com.codeheadsystems.gatekeeper.crypto.Argon2Config;
import com.codeheadsystems.gatekeeper.crypto.PasswordHasher;
import com.codeheadsystems.gatekeeper.crypto.RandomProvider;
import com.codeheadsystems.gatekeeper.crypto.SecretEnvelope;
import com.codeheadsystems.gatekeeper.crypto.TokenHasher;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.config.RelyingPartySettings;
import com.codeheadsystems.gatekeeper.server.mail.LoggingMailer;
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
import com.codeheadsystems.gatekeeper.server.model.ResetDelivery;
import com.codeheadsystems.gatekeeper.server.passkey.PasskeyProtocol;
import com.codeheadsystems.gatekeeper.server.passkey.PendingCeremony;
import com.codeheadsystems.gatekeeper.server.passkey.StoreCredentialRepository;
import com.codeheadsystems.gatekeeper.server.passkey.YubicoPasskeyProtocol;
import com.codeheadsystems.gatekeeper.server.store.DeviceStore;
import com.codeheadsystems.gatekeeper.server.store.EphemeralStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryDeviceStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryPasskeyStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryRecoveryCodeStore;
import com.codeheadsystems.gatekeeper.server.store.InMemorySessionStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryTimeBoxedTokenStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryTotpSecretStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryTransactionManager;
import com.codeheadsystems.gatekeeper.server.store.InMemoryUserStore;
import com.codeheadsystems.gatekeeper.server.store.PasskeyStore;
import com.codeheadsystems.gatekeeper.server.store.RecoveryCodeStore;
import com.codeheadsystems.gatekeeper.server.store.SessionStore;
import com.codeheadsystems.gatekeeper.server.store.TimeBoxedTokenStore;
import com.codeheadsystems.gatekeeper.server.store.TotpSecretStore;
import com.codeheadsystems.gatekeeper.server.store.TransactionManager;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import com.codeheadsystems.gatekeeper.springboot.health.CeremonyStoreHealthIndicator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration")
@EnableConfigurationProperties(GatekeeperProperties.class)
public class GatekeeperAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(GatekeeperAutoConfiguration.class);

  // ── Primitives ───────────────────────────────────────────────────────────

  /**
   * Default {@link SecureRandom} instance. Override this bean to supply a custom implementation
   * (e.g. an HSM-backed provider):
   * <pre>{@code
   *   @Bean
   *   public SecureRandom secureRandom() {
   *     return SecureRandom.getInstance("NativePRNG");
   *   }
   * }</pre>
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public RandomProvider randomProvider(SecureRandom secureRandom) {
    return new RandomProvider(secureRandom);
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  @Bean
  @ConditionalOnMissingBean
  public TokenHasher tokenHasher() {
    return new TokenHasher();
  }

  @Bean
  @ConditionalOnMissingBean
  public PasswordHasher passwordHasher(GatekeeperProperties props, RandomProvider randomProvider) {
    return new PasswordHasher(
        new Argon2Config(props.getArgon2MemoryKib(), props.getArgon2Iterations(), props.getArgon2Parallelism()),
        randomProvider);
  }

  @Bean
  @ConditionalOnMissingBean
  public SecretEnvelope secretEnvelope(RandomProvider randomProvider) {
    return new SecretEnvelope(randomProvider);
  }

  // ── Configuration ────────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public GatekeeperConfig gatekeeperConfig(GatekeeperProperties props, RandomProvider randomProvider) {
    byte[] secretKey;
    String keyBase64 = props.getSecretKeyBase64();
    if (keyBase64 == null || keyBase64.isEmpty()) {
      log.warn("No secret key configured; generating randomly. "
          + "Stored TOTP secrets will be unreadable after restart. Do not use in production.");
      secretKey = randomProvider.randomBytes(SecretEnvelope.KEY_LENGTH);
    } else {
      secretKey = GatekeeperConfig.decodeSecretKey(keyBase64);
    }
    return new GatekeeperConfig(
        Duration.ofSeconds(props.getSessionTtlSeconds()),
        props.getSessionCookieName(),
        secretKey,
        Duration.ofSeconds(props.getCeremonyTtlSeconds()),
        Duration.ofSeconds(props.getReauthTtlSeconds()),
        Duration.ofSeconds(props.getResetTtlSeconds()),
        Duration.ofSeconds(props.getPasswordResetTtlSeconds()),
        Duration.ofSeconds(props.getInviteTtlSeconds()),
        props.getBaseUrl(),
        props.getTotpIssuer(),
        Set.copyOf(props.getPasswordLoginRoles()),
        props.getRecoveryBatchSize(),
        resetDelivery(props.getResetDelivery()),
        props.getBootstrapToken() == null || props.getBootstrapToken().isBlank() ? null : props.getBootstrapToken())
        .validate();
  }

  /**
   * Password policy from properties. Override with a supplier that reads a database row to make
   * the policy editable at runtime.
   */
  @Bean
  @ConditionalOnMissingBean
  public Supplier<PasswordPolicy> passwordPolicySupplier(GatekeeperProperties props) {
    PasswordPolicy policy = new PasswordPolicy(props.getPasswordMinLength(), props.isPasswordRequireUpper(),
        props.isPasswordRequireLower(), props.isPasswordRequireDigit(), props.isPasswordRequireSymbol());
    return () -> policy;
  }

  @Bean
  @ConditionalOnMissingBean
  public RelyingPartySettings relyingPartySettings(GatekeeperProperties props) {
    return new RelyingPartySettings(props.getRpId(), props.getRpName(), new LinkedHashSet<>(props.getRpOrigins()));
  }

  // ── Collaborators ────────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public UserStore userStore() {
    return new InMemoryUserStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionStore sessionStore() {
    return new InMemorySessionStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public PasskeyStore passkeyStore() {
    return new InMemoryPasskeyStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public TotpSecretStore totpSecretStore() {
    return new InMemoryTotpSecretStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public RecoveryCodeStore recoveryCodeStore() {
    return new InMemoryRecoveryCodeStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public TimeBoxedTokenStore timeBoxedTokenStore() {
    return new InMemoryTimeBoxedTokenStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeviceStore deviceStore() {
    return new InMemoryDeviceStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public TransactionManager transactionManager() {
    return new InMemoryTransactionManager();
  }

  @Bean
  @ConditionalOnMissingBean
  public Mailer mailer() {
    return new LoggingMailer();
  }

  @Bean
  @ConditionalOnMissingBean
  public PasskeyProtocol passkeyProtocol(RelyingPartySettings settings, UserStore userStore,
                                         PasskeyStore passkeyStore, ObjectMapper objectMapper) {
    return new YubicoPasskeyProtocol(settings,
        new StoreCredentialRepository(userStore, passkeyStore, objectMapper), objectMapper);
  }

  @Bean
  @ConditionalOnMissingBean
  public EphemeralStore<PendingCeremony> pendingCeremonyStore(GatekeeperProperties props, GatekeeperConfig config,
                                                              Clock clock) {
    return new EphemeralStore<>("passkey-ceremonies", config.ceremonyTtl(), props.getCeremonyCapacity(), clock);
  }

  // ── Managers ─────────────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public SessionManager sessionManager(SessionStore sessionStore, UserStore userStore, TokenHasher tokenHasher,
                                       RandomProvider randomProvider, GatekeeperConfig config, Clock clock) {
    return new SessionManager(sessionStore, userStore, tokenHasher, randomProvider, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public TimeBoxedTokenManager timeBoxedTokenManager(TimeBoxedTokenStore tokenStore, TokenHasher tokenHasher,
                                                     RandomProvider randomProvider, Clock clock) {
    return new TimeBoxedTokenManager(tokenStore, tokenHasher, randomProvider, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public TotpManager totpManager(TotpSecretStore totpSecretStore, DeviceStore deviceStore, UserStore userStore,
                                 SessionManager sessionManager, TransactionManager transactionManager,
                                 SecretEnvelope secretEnvelope, GatekeeperConfig config, Clock clock) {
    return new TotpManager(totpSecretStore, deviceStore, userStore, sessionManager, transactionManager,
        secretEnvelope, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RecoveryCodeManager recoveryCodeManager(RecoveryCodeStore recoveryCodeStore, UserStore userStore,
                                                 SessionManager sessionManager,
                                                 TransactionManager transactionManager,
                                                 PasswordHasher passwordHasher, TokenHasher tokenHasher,
                                                 RandomProvider randomProvider, GatekeeperConfig config,
                                                 Clock clock) {
    return new RecoveryCodeManager(recoveryCodeStore, userStore, sessionManager, transactionManager,
        passwordHasher, tokenHasher, randomProvider, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public PasswordManager passwordManager(UserStore userStore, SessionManager sessionManager,
                                         TimeBoxedTokenManager tokenManager, TransactionManager transactionManager,
                                         PasswordHasher passwordHasher, Supplier<PasswordPolicy> passwordPolicySupplier,
                                         Mailer mailer, GatekeeperConfig config, Clock clock) {
    return new PasswordManager(userStore, sessionManager, tokenManager, transactionManager, passwordHasher,
        passwordPolicySupplier, mailer, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public InviteManager inviteManager(UserStore userStore, TimeBoxedTokenManager tokenManager,
                                     SessionManager sessionManager, TransactionManager transactionManager,
                                     Mailer mailer, GatekeeperConfig config, Clock clock) {
    return new InviteManager(userStore, tokenManager, sessionManager, transactionManager, mailer, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public AccountRecoveryManager accountRecoveryManager(UserStore userStore, TimeBoxedTokenManager tokenManager,
                                                       SessionManager sessionManager, PasskeyStore passkeyStore,
                                                       TotpSecretStore totpSecretStore, DeviceStore deviceStore,
                                                       TransactionManager transactionManager, Mailer mailer,
                                                       GatekeeperConfig config) {
    return new AccountRecoveryManager(userStore, tokenManager, sessionManager, passkeyStore, totpSecretStore,
        deviceStore, transactionManager, mailer, config);
  }

  @Bean
  @ConditionalOnMissingBean
  public ReauthManager reauthManager(UserStore userStore, PasskeyStore passkeyStore,
                                     PasswordManager passwordManager, TotpManager totpManager,
                                     RandomProvider randomProvider, GatekeeperConfig config, Clock clock) {
    return new ReauthManager(userStore, passkeyStore, passwordManager, totpManager, randomProvider, config, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public DeviceManager deviceManager(DeviceStore deviceStore, PasskeyStore passkeyStore,
                                     TotpSecretStore totpSecretStore, TransactionManager transactionManager) {
    return new DeviceManager(deviceStore, passkeyStore, totpSecretStore, transactionManager);
  }

  @Bean
  @ConditionalOnMissingBean
  public LoginOptionsManager loginOptionsManager(UserStore userStore, PasswordManager passwordManager) {
    return new LoginOptionsManager(userStore, passwordManager);
  }

  @Bean
  @ConditionalOnMissingBean
  public BootstrapManager bootstrapManager(UserStore userStore, TotpSecretStore totpSecretStore,
                                           SessionManager sessionManager, GatekeeperConfig config, Clock clock) {
    return new BootstrapManager(userStore, totpSecretStore, sessionManager, config, clock);
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public PasskeyCeremonyManager passkeyCeremonyManager(PasskeyProtocol protocol, PasskeyStore passkeyStore,
                                                       DeviceStore deviceStore, UserStore userStore,
                                                       SessionManager sessionManager, ReauthManager reauthManager,
                                                       TransactionManager transactionManager,
                                                       EphemeralStore<PendingCeremony> pendingCeremonyStore,
                                                       Clock clock) {
    return new PasskeyCeremonyManager(protocol, passkeyStore, deviceStore, userStore, sessionManager,
        reauthManager, transactionManager, pendingCeremonyStore, clock);
  }

  private static ResetDelivery resetDelivery(String value) {
    try {
      return ResetDelivery.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalStateException(
          "gatekeeper.resetDelivery must be 'email' or 'code', was '" + value + "'", e);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
  static class HealthConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CeremonyStoreHealthIndicator ceremonyStoreHealthIndicator(
        EphemeralStore<PendingCeremony> pendingCeremonyStore) {
      return new CeremonyStoreHealthIndicator(pendingCeremonyStore);
    }
  }
}
