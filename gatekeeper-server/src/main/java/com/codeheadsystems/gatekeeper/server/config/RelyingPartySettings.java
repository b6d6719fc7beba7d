package com.codeheadsystems.gatekeeper.server.config;

import java.util.Set;

/**
 * WebAuthn relying party identity.
 *
 * @param id      the rp id, a registrable domain such as {@code example.com}
 * @param name    the human-readable rp name
 * @param origins allowed origins, e.g. {@code https://example.com}
 */
public record RelyingPartySettings(String id, String name, Set<String> origins) {
}
