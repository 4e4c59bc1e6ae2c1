package com.medledger.consentservice.collaborators;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Default signer backed by the JDK's Ed25519 and SHA-256 implementations.
 */
public class Ed25519SignatureProvider implements SignatureProvider {

    private static final String SIGNATURE_ALGORITHM = "Ed25519";
    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final SigningKeySource signingKeys;

    public Ed25519SignatureProvider(SigningKeySource signingKeys) {
        this.signingKeys = signingKeys;
    }

    @Override
    public String sign(String keyRef, byte[] data) {
        try {
            Signature signer = Signature.getInstance(SIGNATURE_ALGORITHM);
            signer.initSign(signingKeys.privateKeyFor(keyRef));
            signer.update(data);
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed for key reference " + keyRef, e);
        }
    }

    @Override
    public boolean verify(PublicKey publicKey, byte[] data, String signature) {
        if (publicKey == null || signature == null || signature.isBlank()) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(data);
            return verifier.verify(Base64.getDecoder().decode(signature));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            // Undecodable or malformed signatures simply do not verify.
            return false;
        }
    }

    @Override
    public String hash(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance(DIGEST_ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " algorithm not available", e);
        }
    }
}
