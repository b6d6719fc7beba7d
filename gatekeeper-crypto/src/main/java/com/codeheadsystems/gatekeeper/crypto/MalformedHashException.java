package com.codeheadsystems.gatekeeper.crypto;

/**
 * Thrown when a stored slow hash cannot be parsed. Indicates data corruption, never a wrong secret.
 */
public class MalformedHashException extends RuntimeException {

  /**
   * Instantiates a new Malformed hash exception.
   *
   * @param message the message
   */
  public MalformedHashException(String message) {
    super(message);
  }

  /**
   * Instantiates a new Malformed hash exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MalformedHashException(String message, Throwable cause) {
    super(message, cause);
  }
}
