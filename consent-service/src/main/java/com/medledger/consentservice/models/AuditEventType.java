package com.medledger.consentservice.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.models.details.AccountEventDetails;
import com.medledger.consentservice.models.details.AuditDetails;
import com.medledger.consentservice.models.details.ConsentGrantedDetails;
import com.medledger.consentservice.models.details.ConsentRevokedDetails;
import com.medledger.consentservice.models.details.RecordAccessDetails;
import com.medledger.consentservice.models.details.RecordCreatedDetails;

public enum AuditEventType {
    USER_REGISTRATION("user_registration", AccountEventDetails.class, true),
    USER_APPROVAL("user_approval", AccountEventDetails.class, true),
    RECORD_CREATED("record_created", RecordCreatedDetails.class, false),
    RECORD_ACCESSED("record_accessed", RecordAccessDetails.class, false),
    CONSENT_GRANTED("consent_granted", ConsentGrantedDetails.class, false),
    CONSENT_REVOKED("consent_revoked", ConsentRevokedDetails.class, false),
    LOGIN_ATTEMPT("login_attempt", AccountEventDetails.class, true);

    private final String value;
    private final Class<? extends AuditDetails> detailsType;
    // Account events come from other services; the rest are written only by this engine.
    private final boolean externallyReported;

    AuditEventType(String value, Class<? extends AuditDetails> detailsType, boolean externallyReported) {
        this.value = value;
        this.detailsType = detailsType;
        this.externallyReported = externallyReported;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Class<? extends AuditDetails> getDetailsType() {
        return detailsType;
    }

    public boolean isExternallyReported() {
        return externallyReported;
    }

    public boolean accepts(AuditDetails details) {
        return details != null && detailsType.isInstance(details);
    }

    @JsonCreator
    public static AuditEventType fromValue(String value) {
        if (value != null) {
            for (AuditEventType type : values()) {
                if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        throw new BadRequestException("Invalid event type: " + value);
    }
}
