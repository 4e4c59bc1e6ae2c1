package com.medledger.consentservice.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Error kinds surfaced to the HTTP layer. Each maps to exactly one status code.
 */
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST, false),
    INVALID_EXPIRATION(HttpStatus.BAD_REQUEST, false),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    FORBIDDEN(HttpStatus.FORBIDDEN, false),
    DENIED(HttpStatus.FORBIDDEN, false),
    ALREADY_REVOKED(HttpStatus.CONFLICT, false),
    CONFLICT(HttpStatus.CONFLICT, true),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, true),
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final HttpStatus status;
    private final boolean retryable;

    ErrorKind(HttpStatus status, boolean retryable) {
        this.status = status;
        this.retryable = retryable;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
