package com.codeheadsystems.gatekeeper.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.gatekeeper.server.GatekeeperFixture;
import com.codeheadsystems.gatekeeper.server.error.AuthErrorKind;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.mail.Mailer;
import com.codeheadsystems.gatekeeper.server.passkey.PasskeyProtocol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LoginOptionsManagerTest {

  @Mock private Mailer mailer;
  @Mock private PasskeyProtocol protocol;

  private GatekeeperFixture fx;

  @BeforeEach
  void setUp() {
    fx = new GatekeeperFixture(mailer, protocol);
  }

  @Test
  void methods_studentWithPassword_includesPassword() {
    fx.userWithPassword("sam", "student", "hunter22");

    assertThat(fx.loginOptionsManager.methods("sam")).containsExactly("passkey", "totp", "recovery", "password");
  }

  @Test
  void methods_adminWithPassword_noPassword() {
    fx.userWithPassword("root", "admin", "hunter22");

    assertThat(fx.loginOptionsManager.methods("root")).containsExactly("passkey", "totp", "recovery");
  }

  @Test
  void methods_studentWithoutPassword_noPassword() {
    fx.user("newbie", "student");

    assertThat(fx.loginOptionsManager.methods("newbie")).doesNotContain("password");
  }

  @Test
  void methods_unknownUser_notFound() {
    assertThatThrownBy(() -> fx.loginOptionsManager.methods("ghost"))
        .isInstanceOfSatisfying(AuthException.class,
            e -> assertThat(e.kind()).isEqualTo(AuthErrorKind.NOT_FOUND));
  }
}
