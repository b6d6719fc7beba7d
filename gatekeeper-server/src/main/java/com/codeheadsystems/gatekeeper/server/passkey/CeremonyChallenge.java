package com.codeheadsystems.gatekeeper.server.passkey;

/**
 * Output of a ceremony start.
 *
 * @param publicKeyJson options to hand to {@code navigator.credentials.create/get}
 * @param protocolState opaque state to return to the matching finish call
 */
public record CeremonyChallenge(String publicKeyJson, String protocolState) {
}
