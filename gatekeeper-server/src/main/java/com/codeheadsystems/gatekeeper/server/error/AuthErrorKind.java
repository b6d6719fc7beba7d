package com.codeheadsystems.gatekeeper.server.error;

/**
 * Failure categories surfaced to the request-handling layer. Each maps to one class of HTTP
 * response in the caller; this module never builds responses itself.
 */
public enum AuthErrorKind {
  /** Startup-only, fatal. */
  CONFIGURATION,
  /** Malformed caller input. */
  VALIDATION,
  /** Missing, invalid or expired session or credential. */
  UNAUTHENTICATED,
  /** Authenticated but not entitled. */
  FORBIDDEN,
  /** Referenced entity absent. */
  NOT_FOUND,
  /** Request cannot be honored in the current state. */
  BAD_REQUEST,
  /** Duplicate credential, username or similar. */
  CONFLICT,
  /** Cryptographic or storage failure not attributable to the caller. */
  INTERNAL
}
