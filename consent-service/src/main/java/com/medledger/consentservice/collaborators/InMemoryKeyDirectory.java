package com.medledger.consentservice.collaborators;

import lombok.extern.slf4j.Slf4j;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Development key custody: one Ed25519 key pair per key reference, generated on first use
 * and kept in memory only.
 */
@Slf4j
public class InMemoryKeyDirectory implements KeyDirectory, SigningKeySource {

    private static final String ALGORITHM = "Ed25519";

    private final Map<String, KeyPair> keyPairs = new ConcurrentHashMap<>();

    @Override
    public PublicKey publicKeyFor(String keyRef) {
        return keyPairFor(keyRef).getPublic();
    }

    @Override
    public PrivateKey privateKeyFor(String keyRef) {
        return keyPairFor(keyRef).getPrivate();
    }

    private KeyPair keyPairFor(String keyRef) {
        if (keyRef == null || keyRef.isBlank()) {
            throw new IllegalArgumentException("Key reference is required");
        }
        return keyPairs.computeIfAbsent(keyRef, this::generate);
    }

    private KeyPair generate(String keyRef) {
        try {
            KeyPair keyPair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            log.debug("Generated {} key pair for key reference {}", ALGORITHM, keyRef);
            return keyPair;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " algorithm not available", e);
        }
    }
}
