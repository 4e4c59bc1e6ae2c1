package com.medledger.consentservice.collaborators;

public class BlobNotFoundException extends RuntimeException {

    public BlobNotFoundException(String contentHash) {
        super("No blob stored under content hash " + contentHash);
    }
}
