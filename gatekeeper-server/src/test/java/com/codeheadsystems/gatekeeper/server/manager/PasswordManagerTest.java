package com.codeheadsystems.gatekeeper.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.codeheadsystems.gatekeeper.server.GatekeeperFixture;
import com.codeheadsystems.gatekeeper.server.error.AuthErrorKind;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.mail.MailDeliveryException;
import com.codeheadsystems.gatekeeper.server.mail.Mailer;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.TokenPurpose;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.passkey.PasskeyProtocol;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PasswordManagerTest {

  @Mock private Mailer mailer;
  @Mock private PasskeyProtocol protocol;

  private GatekeeperFixture fx;
  private PasswordManager passwords;
  private User student;

  @BeforeEach
  void setUp() {
    fx = new GatekeeperFixture(mailer, protocol);
    passwords = fx.passwordManager;
    student = fx.userWithPassword("sam", "student", "hunter22");
  }

  @Test
  void login_correctPassword_issuesSession() {
    IssuedSession session = passwords.login("sam", "hunter22");
    assertThat(fx.sessionManager.validate(session.rawToken()).id()).isEqualTo(student.id());
  }

  @Test
  void login_wrongPassword_unauthenticated() {
    assertThatThrownBy(() -> passwords.login("sam", "hunter23"))
        .isInstanceOfSatisfying(AuthException.class, e -> {
          assertThat(e.kind()).isEqualTo(AuthErrorKind.UNAUTHENTICATED);
          assertThat(e.publicMessage()).isEqualTo("authentication failed");
        });
  }

  @Test
  void login_roleWithoutPasswordLogin_rejected() {
    fx.userWithPassword("root", "admin", "hunter22");

    assertThatThrownBy(() -> passwords.login("root", "hunter22"))
        .isInstanceOf(AuthException.class)
        .hasMessage("password login not allowed");
  }

  @Test
  void login_disabledUser_rejected() {
    fx.userStore.update(student.withActive(false));

    assertThatThrownBy(() -> passwords.login("sam", "hunter22"))
        .isInstanceOf(AuthException.class)
        .hasMessage("user disabled");
  }

  @Test
  void assignTemporaryPassword_flagsUserUntilChanged() {
    IssuedSession before = passwords.login("sam", "hunter22");

    passwords.assignTemporaryPassword(student.id(), "welcome01");

    assertThatThrownBy(() -> fx.sessionManager.validate(before.rawToken()))
        .isInstanceOf(AuthException.class);
    IssuedSession session = passwords.login("sam", "welcome01");
    assertThat(fx.sessionManager.validate(session.rawToken()).mustChangePassword()).isTrue();

    passwords.changePassword(student.id(), "welcome01", "newpass99");

    assertThat(fx.sessionManager.validate(session.rawToken()).mustChangePassword()).isFalse();
  }

  @Test
  void assignTemporaryPassword_roleWithoutPasswordLogin_forbidden() {
    User admin = fx.user("root", "admin");

    assertThatThrownBy(() -> passwords.assignTemporaryPassword(admin.id(), "welcome01"))
        .isInstanceOfSatisfying(AuthException.class,
            e -> assertThat(e.kind()).isEqualTo(AuthErrorKind.FORBIDDEN));
    assertThat(fx.userStore.findById(admin.id()).orElseThrow().hasPassword()).isFalse();
  }

  @Test
  void changePassword_policyEnforced() {
    assertThatThrownBy(() -> passwords.changePassword(student.id(), "hunter22", "short1"))
        .isInstanceOfSatisfying(AuthException.class, e -> {
          assertThat(e.kind()).isEqualTo(AuthErrorKind.VALIDATION);
          assertThat(e.getMessage()).isEqualTo("password too short");
        });
    assertThatThrownBy(() -> passwords.changePassword(student.id(), "hunter22", "nodigitshere"))
        .isInstanceOf(AuthException.class)
        .hasMessage("password requires digit");
  }

  @Test
  void changePassword_wrongCurrent_unauthenticated() {
    assertThatThrownBy(() -> passwords.changePassword(student.id(), "nope", "newpass99"))
        .isInstanceOfSatisfying(AuthException.class,
            e -> assertThat(e.kind()).isEqualTo(AuthErrorKind.UNAUTHENTICATED));
  }

  @Test
  void changePassword_updatesHash() {
    fx.clock.advance(Duration.ofDays(1));
    passwords.changePassword(student.id(), "hunter22", "newpass99");

    User updated = fx.userStore.findById(student.id()).orElseThrow();
    assertThat(updated.passwordUpdatedAt()).isEqualTo(fx.clock.instant());
    assertThat(passwords.login("sam", "newpass99").userId()).isEqualTo(student.id());
  }

  @Test
  void requestReset_mailsLink() {
    passwords.requestReset("sam");

    verify(mailer).send(eq("sam@example.com"), anyString(),
        contains("https://gatekeeper.test/password-reset?token="));
  }

  @Test
  void requestReset_mailFailure_internal() {
    doThrow(new MailDeliveryException("smtp down")).when(mailer).send(anyString(), anyString(), anyString());

    assertThatThrownBy(() -> passwords.requestReset("sam"))
        .isInstanceOfSatisfying(AuthException.class,
            e -> assertThat(e.kind()).isEqualTo(AuthErrorKind.INTERNAL));
  }

  @Test
  void requestReset_roleWithoutPasswordLogin_forbidden() {
    fx.user("root", "admin");

    assertThatThrownBy(() -> passwords.requestReset("root"))
        .isInstanceOfSatisfying(AuthException.class,
            e -> assertThat(e.kind()).isEqualTo(AuthErrorKind.FORBIDDEN));
  }

  /**
   * Issue a password-reset token, validate it, consume it through a reset, and check that a second
   * consumption fails, every old session is gone and the new password works.
   */
  @Test
  void passwordResetScenario() {
    IssuedSession before1 = fx.sessionManager.issue(student.id());
    IssuedSession before2 = fx.sessionManager.issue(student.id());
    String token = fx.tokenManager.issueReset(TokenPurpose.PASSWORD, student.id(), Duration.ofMinutes(30));

    assertThat(fx.tokenManager.validate(token, TokenPurpose.PASSWORD).userId()).isEqualTo(student.id());

    fx.clock.advance(Duration.ofMinutes(10));
    assertThat(passwords.confirmReset(token, "brandnew42")).isEqualTo(student.id());

    assertThatThrownBy(() -> fx.tokenManager.consume(token, TokenPurpose.PASSWORD))
        .isInstanceOf(AuthException.class)
        .hasMessage("token expired or already used");
    assertThatThrownBy(() -> passwords.confirmReset(token, "another42"))
        .isInstanceOf(AuthException.class);
    assertThat(fx.sessionStore.countByUserId(student.id())).isZero();
    assertThatThrownBy(() -> fx.sessionManager.validate(before1.rawToken())).isInstanceOf(AuthException.class);
    assertThatThrownBy(() -> fx.sessionManager.validate(before2.rawToken())).isInstanceOf(AuthException.class);
    assertThat(passwords.login("sam", "brandnew42").userId()).isEqualTo(student.id());
  }

  @Test
  void confirmReset_policyFailure_leavesTokenUsable() {
    String token = fx.tokenManager.issueReset(TokenPurpose.PASSWORD, student.id(), Duration.ofMinutes(30));

    assertThatThrownBy(() -> passwords.confirmReset(token, "x")).isInstanceOf(AuthException.class);

    assertThat(fx.tokenManager.find(token)).isPresent();
  }

  @Test
  void confirmReset_withMailedToken() {
    passwords.requestReset("sam");
    ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
    verify(mailer).send(anyString(), anyString(), body.capture());
    String token = body.getValue().substring(body.getValue().indexOf("token=") + "token=".length());

    passwords.confirmReset(token, "mailed123");

    assertThat(passwords.login("sam", "mailed123").userId()).isEqualTo(student.id());
  }
}
