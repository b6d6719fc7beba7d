package com.codeheadsystems.gatekeeper.server.passkey;

/**
 * What {@link YubicoPasskeyProtocol} persists per credential, serialized as JSON.
 *
 * @param publicKeyCose  COSE public key, unpadded base64url
 * @param signatureCount last accepted signature counter
 * @param backupEligible whether the credential may be synced
 * @param backedUp       whether the credential is currently synced
 */
public record AuthenticatorState(String publicKeyCose,
                                 long signatureCount,
                                 boolean backupEligible,
                                 boolean backedUp) {
}
