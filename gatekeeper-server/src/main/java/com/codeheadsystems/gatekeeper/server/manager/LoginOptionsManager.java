package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.server.error.AuthException;
import com.codeheadsystems.gatekeeper.server.model.User;
import com.codeheadsystems.gatekeeper.server.store.UserStore;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Lists the login methods offered for a username. This necessarily reveals whether the account exists.
 */
@Singleton
public class LoginOptionsManager {

  private final UserStore userStore;
  private final PasswordManager passwordManager;

  @Inject
  public LoginOptionsManager(UserStore userStore, PasswordManager passwordManager) {
    this.userStore = userStore;
    this.passwordManager = passwordManager;
  }

  /**
   * Login methods for the user.
   *
   * @param username the username
   * @return method tags in display order
   * @throws AuthException NOT_FOUND for an unknown user
   */
  public List<String> methods(String username) {
    User user = userStore.findByUsername(username)
        .orElseThrow(() -> AuthException.notFound("user not found"));
    List<String> methods = new ArrayList<>(List.of("passkey", "totp", "recovery"));
    if (passwordManager.passwordLoginAllowed(user)) {
      methods.add("password");
    }
    return methods;
  }
}
