package com.medledger.consentservice.exceptions;

import com.medledger.consentservice.models.DecisionReason;

public class AccessDeniedException extends ConsentEngineException {

    private final DecisionReason reason;

    public AccessDeniedException(String message, DecisionReason reason) {
        super(ErrorKind.DENIED, message);
        this.reason = reason;
    }

    public DecisionReason getReason() {
        return reason;
    }
}
