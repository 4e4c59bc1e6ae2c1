package com.medledger.consentservice.exceptions;

public class ForbiddenException extends ConsentEngineException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
