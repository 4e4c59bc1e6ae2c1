package com.medledger.consentservice.exceptions;

public class InvalidExpirationException extends ConsentEngineException {

    public InvalidExpirationException(String message) {
        super(ErrorKind.INVALID_EXPIRATION, message);
    }
}
