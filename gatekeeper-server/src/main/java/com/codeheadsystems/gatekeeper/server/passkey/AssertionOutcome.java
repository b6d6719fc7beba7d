package com.codeheadsystems.gatekeeper.server.passkey;

/**
 * Result of a successful authentication.
 *
 * @param credentialId       unpadded base64url credential id
 * @param authenticatorState updated opaque blob
 * @param counterAdvanced    whether the signature counter advanced
 */
public record AssertionOutcome(String credentialId, String authenticatorState, boolean counterAdvanced) {
}
