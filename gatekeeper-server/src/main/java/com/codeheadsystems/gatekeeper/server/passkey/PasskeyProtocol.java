package com.codeheadsystems.gatekeeper.server.passkey;

/**
 * The WebAuthn ceremony capability. Implementations own the wire format of the challenge and the
 * client response; callers treat the protocol state as an opaque string to hold between begin and
 * finish, and the authenticator state as an opaque blob to persist.
 * <p>
 * <strong>Exception contract:</strong> every method reports failure as a
 * {@link PasskeyProtocolException}. A rejected signature counter during
 * {@link #finishAuthentication} is such a failure.
 */
public interface PasskeyProtocol {

  /**
   * Begins registration for a user. Credentials the user already holds are excluded.
   *
   * @param user the user
   * @return the challenge
   */
  CeremonyChallenge beginRegistration(PasskeyUser user);

  /**
   * Validates the client's attestation against the stored state.
   *
   * @param protocolState state from {@link #beginRegistration}
   * @param responseJson  the client response
   * @return the new credential
   */
  NewCredential finishRegistration(String protocolState, String responseJson);

  /**
   * Begins authentication against the credentials registered for the username.
   *
   * @param username the username
   * @return the challenge
   */
  CeremonyChallenge beginAuthentication(String username);

  /**
   * Validates the client's assertion against the stored state.
   *
   * @param protocolState state from {@link #beginAuthentication}
   * @param responseJson  the client response
   * @return the outcome
   */
  AssertionOutcome finishAuthentication(String protocolState, String responseJson);
}
