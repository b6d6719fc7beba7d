package com.codeheadsystems.gatekeeper.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.gatekeeper.crypto.RandomProvider;
import com.codeheadsystems.gatekeeper.server.GatekeeperFixture;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperConfig;
import com.codeheadsystems.gatekeeper.server.error.AuthErrorKind;
import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.mail.Mailer;
import com.codeheadsystems.gatekeeper.server.model.IssuedSession;
import com.codeheadsystems.gatekeeper.server.model.TotpSecret;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.passkey.PasskeyProtocol;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BootstrapManagerTest {

  @Mock private Mailer mailer;
  @Mock private PasskeyProtocol protocol;

  private GatekeeperFixture fx;
  private BootstrapManager bootstrap;

  @BeforeEach
  void setUp() {
    fx = new GatekeeperFixture(mailer, protocol);
    bootstrap = fx.bootstrapManager;
  }

  private GatekeeperFixture tokenFixture() {
    GatekeeperConfig config = GatekeeperConfig.defaults(new RandomProvider().randomBytes(32), "https://gatekeeper.test")
        .withBootstrapToken("let-me-in");
    return new GatekeeperFixture(config, mailer, protocol);
  }

  @Test
  void status_emptySystem_neitherReadyNorNeedsTotp() {
    assertThat(bootstrap.status()).isEqualTo(new BootstrapManager.BootstrapStatus(false, false));
  }

  @Test
  void createAdmin_emptySystem_createsAdminWithSession() {
    IssuedSession session = bootstrap.createAdmin(null, " root ", null);

    User admin = fx.sessionManager.validate(session.rawToken());
    assertThat(admin.username()).isEqualTo("root");
    assertThat(admin.displayName()).isEqualTo("root");
    assertThat(admin.role()).isEqualTo(BootstrapManager.ADMIN_ROLE);
    assertThat(admin.hasPassword()).isFalse();
    assertThat(bootstrap.status()).isEqualTo(new BootstrapManager.BootstrapStatus(false, true));
  }

  @Test
  void status_adminWithEnabledTotp_ready() {
    IssuedSession session = bootstrap.createAdmin(null, "root", "Root Admin");
    UUID adminId = session.userId();
    fx.totpSecretStore.insert(new TotpSecret(UUID.randomUUID(), adminId, "SECv1:x", true, fx.clock.instant(), null));

    assertThat(bootstrap.status()).isEqualTo(new BootstrapManager.BootstrapStatus(true, false));
  }

  @Test
  void status_onlyStudentTotp_stillNeedsAdminTotp() {
    User student = fx.user("sam", "student");
    fx.totpSecretStore.insert(new TotpSecret(UUID.randomUUID(), student.id(), "SECv1:x", true, fx.clock.instant(),
        null));

    assertThat(bootstrap.status().needsTotp()).isTrue();
  }

  @Test
  void createAdmin_anyUserExists_badRequest() {
    fx.user("sam", "student");

    assertThatThrownBy(() -> bootstrap.createAdmin(null, "root", null))
        .isInstanceOfSatisfying(AuthException.class, e -> {
          assertThat(e.kind()).isEqualTo(AuthErrorKind.BAD_REQUEST);
          assertThat(e.getMessage()).isEqualTo("bootstrap already completed");
        });
    assertThat(fx.userStore.findByUsername("root")).isEmpty();
  }

  @Test
  void createAdmin_secondCall_badRequest() {
    bootstrap.createAdmin(null, "root", null);

    assertThatThrownBy(() -> bootstrap.createAdmin(null, "root2", null))
        .isInstanceOf(AuthException.class)
        .hasMessage("bootstrap already completed");
  }

  @Test
  void createAdmin_blankUsername_badRequest() {
    assertThatThrownBy(() -> bootstrap.createAdmin(null, " ", null))
        .isInstanceOfSatisfying(AuthException.class,
            e -> assertThat(e.kind()).isEqualTo(AuthErrorKind.BAD_REQUEST));
  }

  @Test
  void createAdmin_wrongToken_unauthenticated() {
    GatekeeperFixture guarded = tokenFixture();

    assertThatThrownBy(() -> guarded.bootstrapManager.createAdmin("guess", "root", null))
        .isInstanceOfSatisfying(AuthException.class, e -> {
          assertThat(e.kind()).isEqualTo(AuthErrorKind.UNAUTHENTICATED);
          assertThat(e.getMessage()).isEqualTo("invalid bootstrap token");
        });
    assertThatThrownBy(() -> guarded.bootstrapManager.createAdmin(null, "root", null))
        .isInstanceOf(AuthException.class)
        .hasMessage("invalid bootstrap token");
    assertThat(guarded.userStore.count()).isZero();
  }

  @Test
  void createAdmin_correctToken_succeeds() {
    GatekeeperFixture guarded = tokenFixture();

    IssuedSession session = guarded.bootstrapManager.createAdmin("let-me-in", "root", "Root");

    assertThat(guarded.sessionManager.validate(session.rawToken()).displayName()).isEqualTo("Root");
  }

  @Test
  void createAdmin_tokenCheckedBeforeExistingUsers() {
    GatekeeperFixture guarded = tokenFixture();
    guarded.user("sam", "student");

    assertThatThrownBy(() -> guarded.bootstrapManager.createAdmin("guess", "root", null))
        .isInstanceOf(AuthException.class)
        .hasMessage("invalid bootstrap token");
  }
}
