package com.medledger.consentservice.collaborators;

import lombok.extern.slf4j.Slf4j;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.HexFormat;

/**
 * Content-addressed blob store kept in memory. Content hashes are SHA-256 hex digests.
 */
@Slf4j
public class InMemoryBlobStore implements BlobStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public String put(byte[] content) {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Blob content must not be empty");
        }
        String contentHash = digest(content);
        blobs.putIfAbsent(contentHash, content.clone());
        log.debug("Stored blob {} ({} bytes)", contentHash, content.length);
        return contentHash;
    }

    @Override
    public byte[] get(String contentHash) {
        byte[] content = blobs.get(contentHash);
        if (content == null) {
            throw new BlobNotFoundException(contentHash);
        }
        return content.clone();
    }

    @Override
    public boolean exists(String contentHash) {
        return contentHash != null && blobs.containsKey(contentHash);
    }

    private String digest(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
