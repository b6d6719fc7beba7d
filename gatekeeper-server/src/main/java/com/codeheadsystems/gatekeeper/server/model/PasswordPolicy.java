package com.codeheadsystems.gatekeeper.server.model;

import com.codeheadsystems.gatekeeper.server.error.AuthException;

/**
 * Password complexity rules.
 *
 * @param minLength      minimum length in characters
 * @param requireUpper   at least one uppercase letter
 * @param requireLower   at least one lowercase letter
 * @param requireDigit   at least one digit
 * @param requireSymbol  at least one non-alphanumeric character
 */
public record PasswordPolicy(int minLength,
                             boolean requireUpper,
                             boolean requireLower,
                             boolean requireDigit,
                             boolean requireSymbol) {

  public static final PasswordPolicy DEFAULT = new PasswordPolicy(8, false, false, true, false);

  /**
   * Validates the password.
   *
   * @param password the password
   * @throws AuthException VALIDATION naming the first rule that failed
   */
  public void validate(String password) {
    if (password == null || password.length() < minLength) {
      throw AuthException.validation("password too short");
    }
    if (requireUpper && password.chars().noneMatch(Character::isUpperCase)) {
      throw AuthException.validation("password requires uppercase letter");
    }
    if (requireLower && password.chars().noneMatch(Character::isLowerCase)) {
      throw AuthException.validation("password requires lowercase letter");
    }
    if (requireDigit && password.chars().noneMatch(Character::isDigit)) {
      throw AuthException.validation("password requires digit");
    }
    if (requireSymbol && password.chars().allMatch(Character::isLetterOrDigit)) {
      throw AuthException.validation("password requires symbol");
    }
  }
}
