package com.codeheadsystems.gatekeeper.crypto;

/**
 * Thrown when an envelope cannot be produced or opened.
 * The message never distinguishes between a bad version tag, bad encoding, truncation,
 * authentication failure or a wrong key.
 */
public class SecretEnvelopeException extends RuntimeException {

  /**
   * Instantiates a new Secret envelope exception.
   *
   * @param cause the underlying failure, kept for server-side logs only
   */
  public SecretEnvelopeException(Throwable cause) {
    super("secret envelope failure", cause);
  }

  /**
   * Instantiates a new Secret envelope exception without a cause.
   */
  public SecretEnvelopeException() {
    super("secret envelope failure");
  }
}
