package com.medledger.consentservice.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.medledger.consentservice.exceptions.BadRequestException;

/**
 * Fixed categories of medical record a consent permission can refer to.
 */
public enum ResourceType {
    DIAGNOSIS("diagnosis"),
    PRESCRIPTION("prescription"),
    LAB_RESULT("lab_result"),
    IMAGING("imaging"),
    CONSULTATION_NOTE("consultation_note");

    private final String value;

    ResourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ResourceType fromValue(String value) {
        if (value != null) {
            for (ResourceType type : values()) {
                if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        throw new BadRequestException("Invalid resource type: " + value);
    }
}
