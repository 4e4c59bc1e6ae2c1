package com.medledger.consentservice.exceptions;

public class ConflictException extends ConsentEngineException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}
