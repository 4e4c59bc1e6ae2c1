package com.medledger.consentservice.models.details;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed payload of an audit entry. Each event family has its own subclass with the
 * fields it must carry; {@code attributes} keeps room for extra, free-form context.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ConsentGrantedDetails.class, name = "consent_granted"),
        @JsonSubTypes.Type(value = ConsentRevokedDetails.class, name = "consent_revoked"),
        @JsonSubTypes.Type(value = RecordAccessDetails.class, name = "record_access"),
        @JsonSubTypes.Type(value = RecordCreatedDetails.class, name = "record_created"),
        @JsonSubTypes.Type(value = AccountEventDetails.class, name = "account_event")
})
@Getter
@Setter
public abstract class AuditDetails {

    private Map<String, Object> attributes = new LinkedHashMap<>();

    public AuditDetails withAttribute(String key, Object value) {
        this.attributes.put(key, value);
        return this;
    }
}
