package com.medledger.consentservice.services;

import com.medledger.consentservice.collaborators.BlobNotFoundException;
import com.medledger.consentservice.collaborators.BlobStore;
import com.medledger.consentservice.configurations.ConsentEngineProperties;
import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.exceptions.DependencyUnavailableException;
import com.medledger.consentservice.models.AccessDecision;
import com.medledger.consentservice.models.AccessLevel;
import com.medledger.consentservice.models.AuditEntry;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.MedicalRecord;
import com.medledger.consentservice.models.details.RecordAccessDetails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Request-facing path for reading a record. Every call, whatever its outcome, leaves exactly
 * one {@code record_accessed} audit entry, and ciphertext is only returned once that entry
 * is durable. Dependency failures are reported as unavailability and never as a denial.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordAccessOrchestrator {

    private final MedicalRecordService medicalRecordService;
    private final AccessEvaluator accessEvaluator;
    private final BlobStore blobStore;
    private final AuditLedgerWriter auditWriter;
    private final DependencyCalls dependencyCalls;
    private final ConsentEngineProperties properties;

    public RecordAccessResult accessRecord(String recordId, String requesterId, Instant now) {
        return accessRecord(recordId, requesterId, now, properties.getDependencies().getTimeout());
    }

    public RecordAccessResult accessRecord(String recordId, String requesterId, Instant now, Duration timeout) {
        if (recordId == null || recordId.isBlank()) {
            throw new BadRequestException("recordId is required");
        }
        if (requesterId == null || requesterId.isBlank()) {
            throw new BadRequestException("requesterId is required");
        }

        Optional<MedicalRecord> found;
        try {
            found = dependencyCalls.call("record-metadata", () -> medicalRecordService.findRecord(recordId), timeout);
        } catch (DependencyUnavailableException e) {
            return unavailable(recordId, requesterId, null, e);
        }
        if (found.isEmpty()) {
            AuditEntry entry = audit(recordId, requesterId, RecordAccessDetails.builder()
                    .outcome(RecordAccessDetails.OUTCOME_NOT_FOUND)
                    .build());
            log.warn("Record {} requested by {} does not exist", recordId, requesterId);
            return RecordAccessResult.builder()
                    .outcome(RecordAccessResult.Outcome.NOT_FOUND)
                    .recordId(recordId)
                    .auditEntryId(entry.getEntryId())
                    .build();
        }
        MedicalRecord record = found.get();

        AccessDecision decision;
        try {
            decision = dependencyCalls.call("consent-store", () -> accessEvaluator.evaluate(requesterId,
                    record.getPatientId(), record.getResourceType(), AccessLevel.READ, now), timeout);
        } catch (DependencyUnavailableException e) {
            return unavailable(recordId, requesterId, record, e);
        }

        if (!decision.isGranted()) {
            AuditEntry entry = audit(recordId, requesterId, base(record)
                    .outcome(RecordAccessDetails.OUTCOME_DENIED)
                    .reason(decision.getReason().name())
                    .build());
            log.warn("Access to record {} by {} denied: {}", recordId, requesterId, decision.getReason());
            return RecordAccessResult.builder()
                    .outcome(RecordAccessResult.Outcome.DENIED)
                    .recordId(recordId)
                    .reason(decision.getReason())
                    .auditEntryId(entry.getEntryId())
                    .build();
        }

        byte[] ciphertext;
        try {
            ciphertext = dependencyCalls.call("blob-store", () -> blobStore.get(record.getContentHash()), timeout);
        } catch (DependencyUnavailableException | BlobNotFoundException e) {
            AuditEntry entry = audit(recordId, requesterId, base(record)
                    .outcome(RecordAccessDetails.OUTCOME_STORAGE_UNAVAILABLE)
                    .reason(decision.getReason().name())
                    .matchedTokenId(decision.getMatchedTokenId())
                    .build());
            log.error("Access to record {} by {} granted but ciphertext fetch failed: {}",
                    recordId, requesterId, e.getMessage());
            return RecordAccessResult.builder()
                    .outcome(RecordAccessResult.Outcome.STORAGE_UNAVAILABLE)
                    .recordId(recordId)
                    .reason(decision.getReason())
                    .matchedTokenId(decision.getMatchedTokenId())
                    .auditEntryId(entry.getEntryId())
                    .failure(e.getMessage())
                    .build();
        }

        AuditEntry entry = audit(recordId, requesterId, base(record)
                .outcome(RecordAccessDetails.OUTCOME_GRANTED)
                .reason(decision.getReason().name())
                .matchedTokenId(decision.getMatchedTokenId())
                .build());
        log.info("Record {} released to {} under consent {}", recordId, requesterId, decision.getMatchedTokenId());
        return RecordAccessResult.builder()
                .outcome(RecordAccessResult.Outcome.GRANTED)
                .recordId(recordId)
                .reason(decision.getReason())
                .matchedTokenId(decision.getMatchedTokenId())
                .record(record)
                .ciphertext(ciphertext)
                .auditEntryId(entry.getEntryId())
                .build();
    }

    private RecordAccessResult unavailable(String recordId, String requesterId, MedicalRecord record,
                                           DependencyUnavailableException e) {
        RecordAccessDetails.RecordAccessDetailsBuilder details = record != null ? base(record) : RecordAccessDetails.builder();
        AuditEntry entry = audit(recordId, requesterId, details
                .outcome(RecordAccessDetails.OUTCOME_UNAVAILABLE)
                .reason(e.getDependency())
                .build());
        log.error("Access to record {} by {} could not be decided: {}", recordId, requesterId, e.getMessage());
        return RecordAccessResult.builder()
                .outcome(RecordAccessResult.Outcome.UNAVAILABLE)
                .recordId(recordId)
                .auditEntryId(entry.getEntryId())
                .failure(e.getMessage())
                .build();
    }

    private RecordAccessDetails.RecordAccessDetailsBuilder base(MedicalRecord record) {
        return RecordAccessDetails.builder()
                .patientId(record.getPatientId())
                .resourceType(record.getResourceType().getValue());
    }

    private AuditEntry audit(String recordId, String requesterId, RecordAccessDetails details) {
        return auditWriter.append(AuditEventType.RECORD_ACCESSED, requesterId, recordId, details, requesterId);
    }
}
