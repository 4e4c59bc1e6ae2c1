package com.medledger.consentservice.exceptions;

/**
 * The audit ledger could not record an entry, so the operation it belonged to is halted.
 */
public class AuditFailureException extends ConsentEngineException {

    public AuditFailureException(String message, Throwable cause) {
        super(ErrorKind.UNAVAILABLE, message, cause);
    }
}
