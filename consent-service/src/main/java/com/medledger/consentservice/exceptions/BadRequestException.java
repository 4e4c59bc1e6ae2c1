package com.medledger.consentservice.exceptions;

public class BadRequestException extends ConsentEngineException {

    public BadRequestException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
