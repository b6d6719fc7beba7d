package com.codeheadsystems.gatekeeper.server.store;

/**
 * Thrown by a store when an insert violates a unique key.
 */
public class DuplicateKeyException extends RuntimeException {

  public DuplicateKeyException(String message) {
    super(message);
  }
}
