package com.medledger.consentservice.exceptions;

/**
 * Raised when revoking a token that is already inactive. Callers may treat it as an
 * idempotent success.
 */
public class AlreadyRevokedException extends ConsentEngineException {

    private final String tokenId;

    public AlreadyRevokedException(String tokenId) {
        super(ErrorKind.ALREADY_REVOKED, "Consent token already revoked: " + tokenId);
        this.tokenId = tokenId;
    }

    public String getTokenId() {
        return tokenId;
    }
}
