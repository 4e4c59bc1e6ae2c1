package com.medledger.consentservice.services;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RevocationResult {
    String tokenId;
    String patientId;
    String providerId;
    String revokedBy;
    Instant revokedAt;
    String auditEntryId;
    String transactionId;
}
