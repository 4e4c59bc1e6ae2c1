package com.medledger.consentservice.models;

public enum DecisionReason {
    OK,
    NO_CONSENT,
    EXPIRED,
    REVOKED,
    WRONG_RESOURCE_TYPE,
    WRONG_ACCESS_LEVEL
}
