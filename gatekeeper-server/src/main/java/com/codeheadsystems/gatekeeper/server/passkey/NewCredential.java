package com.codeheadsystems.gatekeeper.server.passkey;

/**
 * A credential produced by a successful registration.
 *
 * @param credentialId       unpadded base64url credential id
 * @param authenticatorState opaque blob to persist
 */
public record NewCredential(String credentialId, String authenticatorState) {
}
