package com.codeheadsystems.gatekeeper.server.model;

/**
 * The prospective account carried by an invite.
 *
 * @param username    the username
 * @param email       the email, may be null in code delivery mode
 * @param displayName the display name
 * @param role        the role
 */
public record InviteProfile(String username, String email, String displayName, String role) {
}
