package com.codeheadsystems.gatekeeper.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import com.codeheadsystems.gatekeeper.server.GatekeeperFixture;
import com.codeheadsystems.gatekeeper.server.error.AuthErrorKind;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.mail.Mailer;
import com.codeheadsystems.gatekeeper.server.model.Device;
import com.codeheadsystems.gatekeeper.server.model.DeviceKind;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.PasskeyCredential;
import com.codeheadsystems.gatekeeper.server.model.ResetDelivery;
import com.codeheadsystems.gatekeeper.server.model.TotpSecret;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.passkey.PasskeyProtocol;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AccountRecoveryManagerTest {

  @Mock private Mailer mailer;
  @Mock private PasskeyProtocol protocol;

  private GatekeeperFixture fx;
  private User alice;

  @BeforeEach
  void setUp() {
    fx = new GatekeeperFixture(mailer, protocol);
    alice = fx.user("alice", "student");
    fx.passkeyStore.insert(new PasskeyCredential("cred-1", alice.id(), "{}", fx.clock.instant(), null));
    fx.deviceStore.insert(new Device(UUID.randomUUID(), alice.id(), DeviceKind.PASSKEY, "key", "cred-1",
        fx.clock.instant(), null));
    fx.totpSecretStore.insert(new TotpSecret(UUID.randomUUID(), alice.id(), "SECv1:x", true,
        fx.clock.instant(), fx.clock.instant()));
    fx.deviceStore.insert(new Device(UUID.randomUUID(), alice.id(), DeviceKind.TOTP, "phone", null,
        fx.clock.instant(), null));
  }

  private GatekeeperFixture codeMode() {
    GatekeeperFixture code = new GatekeeperFixture(fx.config.withResetDelivery(ResetDelivery.CODE), mailer, protocol);
    code.userStore.insert(alice);
    return code;
  }

  @Test
  void sendReset_mailsResetLink() {
    fx.accountRecoveryManager.sendReset("alice", "passkey");

    verify(mailer).send(eq("alice@example.com"), anyString(), contains("https://gatekeeper.test/reset?token="));
  }

  @Test
  void sendReset_passwordPurpose_badRequest() {
    assertThatThrownBy(() -> fx.accountRecoveryManager.sendReset("alice", "password"))
        .isInstanceOf(AuthException.class)
        .hasMessage("invalid reset purpose");
  }

  @Test
  void sendReset_codeMode_badRequest() {
    GatekeeperFixture code = codeMode();

    assertThatThrownBy(() -> code.accountRecoveryManager.sendReset("alice", "totp"))
        .isInstanceOfSatisfying(AuthException.class,
            e -> assertThat(e.kind()).isEqualTo(AuthErrorKind.BAD_REQUEST));
  }

  @Test
  void consumeReset_totp_removesTotpOnlyAndRevokesSessions() {
    IssuedSession old = fx.sessionManager.issue(alice.id());
    fx.accountRecoveryManager.sendReset("alice", "totp");
    ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
    verify(mailer).send(anyString(), anyString(), body.capture());
    String token = body.getValue().substring(body.getValue().indexOf("token=") + "token=".length());

    assertThat(fx.accountRecoveryManager.resetStatus(token))
        .isEqualTo(new AccountRecoveryManager.ResetStatus(true, "totp"));
    AccountRecoveryManager.ResetConsumption result = fx.accountRecoveryManager.consumeReset(token);

    assertThat(result.purpose()).isEqualTo("totp");
    assertThat(fx.totpSecretStore.listEnabledByUserId(alice.id())).isEmpty();
    assertThat(fx.passkeyStore.listByUserId(alice.id())).hasSize(1);
    assertThat(fx.deviceStore.listByUserId(alice.id())).extracting(Device::kind).containsExactly(DeviceKind.PASSKEY);
    assertThatThrownBy(() -> fx.sessionManager.validate(old.rawToken())).isInstanceOf(AuthException.class);
    assertThat(fx.sessionManager.validate(result.session().rawToken()).id()).isEqualTo(alice.id());
    assertThat(fx.accountRecoveryManager.resetStatus(token).valid()).isFalse();
  }

  @Test
  void consumeReset_passkey_removesPasskeys() {
    GatekeeperFixture code = codeMode();
    code.passkeyStore.insert(new PasskeyCredential("cred-2", alice.id(), "{}", code.clock.instant(), null));
    String token = code.accountRecoveryManager.issueResetCode("alice", "passkey");

    code.accountRecoveryManager.consumeReset(token);

    assertThat(code.passkeyStore.listByUserId(alice.id())).isEmpty();
  }

  @Test
  void issueResetCode_password_usesPasswordTtlAndIsNotConsumableHere() {
    GatekeeperFixture code = codeMode();
    String token = code.accountRecoveryManager.issueResetCode("alice", "password");

    assertThat(code.tokenManager.find(token).orElseThrow().expiresAt())
        .isEqualTo(GatekeeperFixture.START.plus(code.config.passwordResetTtl()));
    assertThatThrownBy(() -> code.accountRecoveryManager.consumeReset(token))
        .isInstanceOf(AuthException.class)
        .hasMessage("invalid reset purpose");
  }

  @Test
  void issueResetCode_inviteOrUnknownPurpose_badRequest() {
    GatekeeperFixture code = codeMode();

    assertThatThrownBy(() -> code.accountRecoveryManager.issueResetCode("alice", "invite"))
        .isInstanceOf(AuthException.class)
        .hasMessage("invalid reset purpose");
    assertThatThrownBy(() -> code.accountRecoveryManager.issueResetCode("alice", "sms"))
        .isInstanceOf(AuthException.class)
        .hasMessage("invalid reset purpose");
  }

  @Test
  void consumeReset_expired_badRequest() {
    GatekeeperFixture code = codeMode();
    String token = code.accountRecoveryManager.issueResetCode("alice", "totp");
    code.clock.advance(Duration.ofHours(25));

    assertThatThrownBy(() -> code.accountRecoveryManager.consumeReset(token))
        .isInstanceOfSatisfying(AuthException.class,
            e -> assertThat(e.kind()).isEqualTo(AuthErrorKind.BAD_REQUEST));
  }

  @Test
  void consumeReset_unknownToken_notFound() {
    assertThatThrownBy(() -> fx.accountRecoveryManager.consumeReset("nope"))
        .isInstanceOfSatisfying(AuthException.class,
            e -> assertThat(e.kind()).isEqualTo(AuthErrorKind.NOT_FOUND));
  }
}
