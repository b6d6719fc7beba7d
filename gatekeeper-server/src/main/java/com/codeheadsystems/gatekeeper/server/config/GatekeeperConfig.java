package com.codeheadsystems.gatekeeper.server.config;

import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.model.ResetDelivery;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration shared by all managers.
 *
 * @param sessionTtl          lifetime of issued sessions
 * @param sessionCookieName   cookie name the caller should use for the session token
 * @param secretKey           32-byte AES key for secret envelopes
 * @param ceremonyTtl         lifetime of pending passkey ceremonies
 * @param reauthTtl           lifetime of step-up re-authentication grants
 * @param resetTtl            lifetime of TOTP/passkey reset tokens
 * @param passwordResetTtl    lifetime of password reset tokens
 * @param inviteTtl           lifetime of invites
 * @param baseUrl             origin used when building invite and reset links
 * @param totpIssuer          issuer label embedded in otpauth URIs
 * @param passwordLoginRoles  roles that may ever log in with a password
 * @param recoveryBatchSize   recovery codes per batch
 * @param resetDelivery       how invite and reset tokens are delivered
 * @param bootstrapToken      shared secret required to create the first admin, or null for none
 */
public record GatekeeperConfig(Duration sessionTtl,
                               String sessionCookieName,
                               byte[] secretKey,
                               Duration ceremonyTtl,
                               Duration reauthTtl,
                               Duration resetTtl,
                               Duration passwordResetTtl,
                               Duration inviteTtl,
                               String baseUrl,
                               String totpIssuer,
                               Set<String> passwordLoginRoles,
                               int recoveryBatchSize,
                               ResetDelivery resetDelivery,
                               String bootstrapToken) {

  public static final Duration DEFAULT_SESSION_TTL = Duration.ofSeconds(3600);
  public static final String DEFAULT_COOKIE_NAME = "vh_session";
  public static final Duration DEFAULT_CEREMONY_TTL = Duration.ofSeconds(300);
  public static final Duration DEFAULT_REAUTH_TTL = Duration.ofSeconds(300);
  public static final Duration DEFAULT_RESET_TTL = Duration.ofHours(24);
  public static final Duration DEFAULT_PASSWORD_RESET_TTL = Duration.ofHours(24);
  public static final Duration DEFAULT_INVITE_TTL = Duration.ofHours(72);
  public static final String DEFAULT_TOTP_ISSUER = "Labor Hours Platform";
  public static final int DEFAULT_RECOVERY_BATCH_SIZE = 8;

  public GatekeeperConfig {
    secretKey = secretKey == null ? null : secretKey.clone();
  }

  /**
   * Defaults for everything but the key.
   *
   * @param secretKey the secret key
   * @param baseUrl   the base url
   * @return the gatekeeper config
   */
  public static GatekeeperConfig defaults(byte[] secretKey, String baseUrl) {
    return new GatekeeperConfig(DEFAULT_SESSION_TTL, DEFAULT_COOKIE_NAME, secretKey, DEFAULT_CEREMONY_TTL,
        DEFAULT_REAUTH_TTL, DEFAULT_RESET_TTL, DEFAULT_PASSWORD_RESET_TTL, DEFAULT_INVITE_TTL, baseUrl,
        DEFAULT_TOTP_ISSUER, Set.of("student"), DEFAULT_RECOVERY_BATCH_SIZE, ResetDelivery.EMAIL, null);
  }

  /**
   * Decodes a standard base64 key and checks its length.
   *
   * @param base64 the base64 key
   * @return the 32 key bytes
   * @throws AuthException CONFIGURATION if the value is not base64 or not 32 bytes
   */
  public static byte[] decodeSecretKey(String base64) {
    if (base64 == null || base64.isBlank()) {
      throw AuthException.configuration("secret key is not set");
    }
    byte[] key;
    try {
      key = Base64.getDecoder().decode(base64.trim());
    } catch (IllegalArgumentException e) {
      throw AuthException.configuration("secret key must be base64");
    }
    if (key.length != 32) {
      throw AuthException.configuration("secret key must decode to 32 bytes");
    }
    return key;
  }

  public GatekeeperConfig withResetDelivery(ResetDelivery delivery) {
    return new GatekeeperConfig(sessionTtl, sessionCookieName, secretKey, ceremonyTtl, reauthTtl, resetTtl,
        passwordResetTtl, inviteTtl, baseUrl, totpIssuer, passwordLoginRoles, recoveryBatchSize, delivery,
        bootstrapToken);
  }

  public GatekeeperConfig withBootstrapToken(String token) {
    return new GatekeeperConfig(sessionTtl, sessionCookieName, secretKey, ceremonyTtl, reauthTtl, resetTtl,
        passwordResetTtl, inviteTtl, baseUrl, totpIssuer, passwordLoginRoles, recoveryBatchSize, resetDelivery,
        token);
  }

  /**
   * A copy of the key; the record never hands out its own array.
   *
   * @return the key bytes
   */
  @Override
  public byte[] secretKey() {
    return secretKey == null ? null : secretKey.clone();
  }

  /**
   * Fails fast on values that would make the managers misbehave.
   *
   * @return this config
   * @throws AuthException CONFIGURATION
   */
  public GatekeeperConfig validate() {
    if (secretKey == null || secretKey.length != 32) {
      throw AuthException.configuration("secret key must be 32 bytes");
    }
    for (Duration ttl : new Duration[]{sessionTtl, ceremonyTtl, reauthTtl, resetTtl, passwordResetTtl, inviteTtl}) {
      if (ttl == null || ttl.isNegative() || ttl.isZero()) {
        throw AuthException.configuration("TTLs must be positive");
      }
    }
    if (sessionCookieName == null || sessionCookieName.isBlank()) {
      throw AuthException.configuration("session cookie name must be set");
    }
    if (baseUrl == null || baseUrl.isBlank()) {
      throw AuthException.configuration("base url must be set");
    }
    if (recoveryBatchSize < 1) {
      throw AuthException.configuration("recovery batch size must be positive");
    }
    if (resetDelivery == null || passwordLoginRoles == null || totpIssuer == null) {
      throw AuthException.configuration("reset delivery, password roles and TOTP issuer must be set");
    }
    return this;
  }

  /**
   * Link for a flow, e.g. {@code link("/invite", token)}.
   *
   * @param path  the path
   * @param token the raw token
   * @return the url
   */
  public String link(String path, String token) {
    String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    return base + path + "?token=" + token;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GatekeeperConfig other)) {
      return false;
    }
    return recoveryBatchSize == other.recoveryBatchSize
        && Arrays.equals(secretKey, other.secretKey)
        && Objects.equals(sessionTtl, other.sessionTtl)
        && Objects.equals(sessionCookieName, other.sessionCookieName)
        && Objects.equals(ceremonyTtl, other.ceremonyTtl)
        && Objects.equals(reauthTtl, other.reauthTtl)
        && Objects.equals(resetTtl, other.resetTtl)
        && Objects.equals(passwordResetTtl, other.passwordResetTtl)
        && Objects.equals(inviteTtl, other.inviteTtl)
        && Objects.equals(baseUrl, other.baseUrl)
        && Objects.equals(totpIssuer, other.totpIssuer)
        && Objects.equals(passwordLoginRoles, other.passwordLoginRoles)
        && resetDelivery == other.resetDelivery
        && Objects.equals(bootstrapToken, other.bootstrapToken);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(sessionTtl, sessionCookieName, ceremonyTtl, reauthTtl, resetTtl, passwordResetTtl,
        inviteTtl, baseUrl, totpIssuer, passwordLoginRoles, recoveryBatchSize, resetDelivery, bootstrapToken)
        + Arrays.hashCode(secretKey);
  }

  @Override
  public String toString() {
    return "GatekeeperConfig[sessionTtl=" + sessionTtl + ", cookie=" + sessionCookieName
        + ", baseUrl=" + baseUrl + ", resetDelivery=" + resetDelivery + "]";
  }
}
