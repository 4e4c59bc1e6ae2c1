package com.medledger.consentservice.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.medledger.consentservice.exceptions.BadRequestException;

/**
 * Read or write capability over a resource type. Levels are not hierarchical:
 * WRITE never implies READ.
 */
public enum AccessLevel {
    READ("read"),
    WRITE("write");

    private final String value;

    AccessLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AccessLevel fromValue(String value) {
        if (value != null) {
            for (AccessLevel level : values()) {
                if (level.value.equalsIgnoreCase(value)) {
                    return level;
                }
            }
        }
        throw new BadRequestException("Invalid access level: " + value);
    }
}
