package com.codeheadsystems.gatekeeper.server.passkey;

public class PasskeyProtocolException extends RuntimeException {

  public PasskeyProtocolException(String message, Throwable cause) {
    super(message, cause);
  }

  public PasskeyProtocolException(String message) {
    super(message);
  }
}
