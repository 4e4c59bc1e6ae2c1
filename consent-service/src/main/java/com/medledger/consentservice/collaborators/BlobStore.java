package com.medledger.consentservice.collaborators;

/**
 * Content-addressed store for encrypted record payloads.
 */
public interface BlobStore {

    String put(byte[] content);

    /**
     * @throws BlobNotFoundException when nothing is stored under {@code contentHash}
     */
    byte[] get(String contentHash);

    boolean exists(String contentHash);
}
