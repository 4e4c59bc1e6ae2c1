package com.medledger.consentservice.collaborators;

import java.security.PublicKey;

/**
 * Signing and hashing primitives. Signatures and digests are opaque strings to the engine,
 * so a post-quantum scheme can be dropped in without touching consent or audit logic.
 */
public interface SignatureProvider {

    String sign(String keyRef, byte[] data);

    boolean verify(PublicKey publicKey, byte[] data, String signature);

    /**
     * @return lower-case hex digest of {@code data}
     */
    String hash(byte[] data);
}
