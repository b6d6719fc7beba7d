package com.codeheadsystems.gatekeeper.server.passkey;

import java.util.UUID;

/**
 * The user a registration ceremony is for. The user id doubles as the WebAuthn user handle.
 *
 * @param userId      the user id
 * @param username    the username
 * @param displayName the display name
 */
public record PasskeyUser(UUID userId, String username, String displayName) {
}
