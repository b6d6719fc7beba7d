package com.codeheadsystems.gatekeeper.springboot.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gatekeeper")
public class GatekeeperProperties {

  private String secretKeyBase64 = "";
  private String baseUrl = "http://localhost:8080";
  private long sessionTtlSeconds = 3600;
  private String sessionCookieName = "vh_session";
  private long ceremonyTtlSeconds = 300;
  private long reauthTtlSeconds = 300;
  private long resetTtlSeconds = 86400;
  private long passwordResetTtlSeconds = 86400;
  private long inviteTtlSeconds = 259200;
  private String totpIssuer = "Labor Hours Platform";
  private List<String> passwordLoginRoles = new ArrayList<>(List.of("student"));
  private int recoveryBatchSize = 8;
  private String resetDelivery = "email";
  private int ceremonyCapacity = 10_000;
  private String bootstrapToken = "";
  private String rpId = "localhost";
  private String rpName = "Gatekeeper";
  private List<String> rpOrigins = new ArrayList<>(List.of("http://localhost:8080"));
  private int argon2MemoryKib = 65536;
  private int argon2Iterations = 3;
  private int argon2Parallelism = 1;
  private int passwordMinLength = 8;
  private boolean passwordRequireUpper = false;
  private boolean passwordRequireLower = false;
  private boolean passwordRequireDigit = true;
  private boolean passwordRequireSymbol = false;

  public String getSecretKeyBase64() {
    return secretKeyBase64;
  }

  public void setSecretKeyBase64(String secretKeyBase64) {
    this.secretKeyBase64 = secretKeyBase64;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  public String getSessionCookieName() {
    return sessionCookieName;
  }

  public void setSessionCookieName(String sessionCookieName) {
    this.sessionCookieName = sessionCookieName;
  }

  public long getCeremonyTtlSeconds() {
    return ceremonyTtlSeconds;
  }

  public void setCeremonyTtlSeconds(long ceremonyTtlSeconds) {
    this.ceremonyTtlSeconds = ceremonyTtlSeconds;
  }

  public long getReauthTtlSeconds() {
    return reauthTtlSeconds;
  }

  public void setReauthTtlSeconds(long reauthTtlSeconds) {
    this.reauthTtlSeconds = reauthTtlSeconds;
  }

  public long getResetTtlSeconds() {
    return resetTtlSeconds;
  }

  public void setResetTtlSeconds(long resetTtlSeconds) {
    this.resetTtlSeconds = resetTtlSeconds;
  }

  public long getPasswordResetTtlSeconds() {
    return passwordResetTtlSeconds;
  }

  public void setPasswordResetTtlSeconds(long passwordResetTtlSeconds) {
    this.passwordResetTtlSeconds = passwordResetTtlSeconds;
  }

  public long getInviteTtlSeconds() {
    return inviteTtlSeconds;
  }

  public void setInviteTtlSeconds(long inviteTtlSeconds) {
    this.inviteTtlSeconds = inviteTtlSeconds;
  }

  public String getTotpIssuer() {
    return totpIssuer;
  }

  public void setTotpIssuer(String totpIssuer) {
    this.totpIssuer = totpIssuer;
  }

  public List<String> getPasswordLoginRoles() {
    return passwordLoginRoles;
  }

  public void setPasswordLoginRoles(List<String> passwordLoginRoles) {
    this.passwordLoginRoles = passwordLoginRoles;
  }

  public int getRecoveryBatchSize() {
    return recoveryBatchSize;
  }

  public void setRecoveryBatchSize(int recoveryBatchSize) {
    this.recoveryBatchSize = recoveryBatchSize;
  }

  public String getResetDelivery() {
    return resetDelivery;
  }

  public void setResetDelivery(String resetDelivery) {
    this.resetDelivery = resetDelivery;
  }

  public int getCeremonyCapacity() {
    return ceremonyCapacity;
  }

  public void setCeremonyCapacity(int ceremonyCapacity) {
    this.ceremonyCapacity = ceremonyCapacity;
  }

  public String getBootstrapToken() {
    return bootstrapToken;
  }

  public void setBootstrapToken(String bootstrapToken) {
    this.bootstrapToken = bootstrapToken;
  }

  public String getRpId() {
    return rpId;
  }

  public void setRpId(String rpId) {
    this.rpId = rpId;
  }

  public String getRpName() {
    return rpName;
  }

  public void setRpName(String rpName) {
    this.rpName = rpName;
  }

  public List<String> getRpOrigins() {
    return rpOrigins;
  }

  public void setRpOrigins(List<String> rpOrigins) {
    this.rpOrigins = rpOrigins;
  }

  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  public int getPasswordMinLength() {
    return passwordMinLength;
  }

  public void setPasswordMinLength(int passwordMinLength) {
    this.passwordMinLength = passwordMinLength;
  }

  public boolean isPasswordRequireUpper() {
    return passwordRequireUpper;
  }

  public void setPasswordRequireUpper(boolean passwordRequireUpper) {
    this.passwordRequireUpper = passwordRequireUpper;
  }

  public boolean isPasswordRequireLower() {
    return passwordRequireLower;
  }

  public void setPasswordRequireLower(boolean passwordRequireLower) {
    this.passwordRequireLower = passwordRequireLower;
  }

  public boolean isPasswordRequireDigit() {
    return passwordRequireDigit;
  }

  public void setPasswordRequireDigit(boolean passwordRequireDigit) {
    this.passwordRequireDigit = passwordRequireDigit;
  }

  public boolean isPasswordRequireSymbol() {
    return passwordRequireSymbol;
  }

  public void setPasswordRequireSymbol(boolean passwordRequireSymbol) {
    this.passwordRequireSymbol = passwordRequireSymbol;
  }
}
