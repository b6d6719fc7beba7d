package com.codeheadsystems.gatekeeper.server.error;

/**
 * The single failure type thrown by the managers.
 *
 * <p>{@link #getMessage()} carries the detailed reason and is meant for server-side logs.
 * {@link #publicMessage()} is what a caller may show to a client: authentication failures and
 * internal failures are collapsed so a client cannot tell which factor was wrong or why a
 * cryptographic operation failed.
 */
public class AuthException extends RuntimeException {

  private final AuthErrorKind kind;

  /**
   * Instantiates a new Auth exception.
   *
   * @param kind    the kind
   * @param message the detailed message
   */
  public AuthException(AuthErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Instantiates a new Auth exception.
   *
   * @param kind    the kind
   * @param message the detailed message
   * @param cause   the cause
   */
  public AuthException(AuthErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static AuthException configuration(String message) {
    return new AuthException(AuthErrorKind.CONFIGURATION, message);
  }

  public static AuthException validation(String message) {
    return new AuthException(AuthErrorKind.VALIDATION, message);
  }

  public static AuthException unauthenticated(String message) {
    return new AuthException(AuthErrorKind.UNAUTHENTICATED, message);
  }

  public static AuthException forbidden(String message) {
    return new AuthException(AuthErrorKind.FORBIDDEN, message);
  }

  public static AuthException notFound(String message) {
    return new AuthException(AuthErrorKind.NOT_FOUND, message);
  }

  public static AuthException badRequest(String message) {
    return new AuthException(AuthErrorKind.BAD_REQUEST, message);
  }

  public static AuthException conflict(String message) {
    return new AuthException(AuthErrorKind.CONFLICT, message);
  }

  public static AuthException internal(String message, Throwable cause) {
    return new AuthException(AuthErrorKind.INTERNAL, message, cause);
  }

  /**
   * Kind auth error kind.
   *
   * @return the auth error kind
   */
  public AuthErrorKind kind() {
    return kind;
  }

  /**
   * Message safe to return to a client.
   *
   * @return the string
   */
  public String publicMessage() {
    return switch (kind) {
      case UNAUTHENTICATED -> "authentication failed";
      case INTERNAL, CONFIGURATION -> "internal error";
      default -> getMessage();
    };
  }
}
