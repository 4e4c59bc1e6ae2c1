package com.medledger.consentservice.models;

import com.medledger.consentservice.exceptions.BadRequestException;

public enum UserRole {
    ADMIN, DOCTOR, NURSE, PATIENT, RECEPTIONIST, AUDITOR,
    /** Internal callers such as the authentication and user services. */
    SERVICE;

    /**
     * Role named in the gateway's {@code X-User-Role} header, or {@code null} when absent.
     */
    public static UserRole fromHeader(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (UserRole role : values()) {
            if (role.name().equalsIgnoreCase(value.trim())) {
                return role;
            }
        }
        throw new BadRequestException("Invalid role: " + value);
    }

    public boolean canReadAuditTrail() {
        return this == ADMIN || this == AUDITOR;
    }
}
