package com.medledger.consentservice.dto.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medledger.consentservice.models.AuditEntry;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.details.AuditDetails;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@Builder
public class AuditEntryResponse {

    private String entryId;
    private Long blockNumber;
    private AuditEventType eventType;
    private String userId;
    private String resourceId;
    private Instant timestamp;
    private AuditDetails details;
    private String previousHash;
    private String entryHash;
    private String signature;
    private String signerKeyRef;
    private String transactionId;

    public static AuditEntryResponse from(AuditEntry entry, AuditDetails details) {
        return AuditEntryResponse.builder()
                .entryId(entry.getEntryId())
                .blockNumber(entry.getBlockNumber())
                .eventType(entry.getEventType())
                .userId(entry.getUserId())
                .resourceId(entry.getResourceId())
                .timestamp(entry.getTimestamp())
                .details(details)
                .previousHash(entry.getPreviousHash())
                .entryHash(entry.getEntryHash())
                .signature(entry.getSignature())
                .signerKeyRef(entry.getSignerKeyRef())
                .transactionId(entry.getTransactionId())
                .build();
    }
}
