package com.codeheadsystems.gatekeeper.server.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Purpose tag of a time-boxed token. A token only ever satisfies the purpose it was issued for.
 */
public enum TokenPurpose {
  PASSWORD("password"),
  TOTP("totp"),
  PASSKEY("passkey"),
  INVITE("invite");

  private final String tag;

  TokenPurpose(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  /**
   * Resolves a stored or caller-supplied tag.
   *
   * @param tag the tag
   * @return the purpose, empty when unknown
   */
  public static Optional<TokenPurpose> fromTag(String tag) {
    return Arrays.stream(values()).filter(p -> p.tag.equals(tag)).findFirst();
  }
}
