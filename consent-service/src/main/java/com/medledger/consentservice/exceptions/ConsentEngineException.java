package com.medledger.consentservice.exceptions;

/**
 * Base class of every error the engine raises on purpose. Carries the {@link ErrorKind}
 * the HTTP layer uses to pick a status code.
 */
public abstract class ConsentEngineException extends RuntimeException {

    private final ErrorKind kind;

    protected ConsentEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ConsentEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
