package com.medledger.consentservice.exceptions;

public class ResourceNotFoundException extends ConsentEngineException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
