package com.medledger.consentservice.services;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class ConsentStatusSummary {
    String patientId;
    String providerId;
    int totalGrants;
    int activeGrants;
    int revokedGrants;
    int expiredGrants;
    /** Resource type to the access levels currently granted for it. */
    Map<String, Set<String>> effectivePermissions;
    Instant asOf;
}
