package com.medledger.consentservice.services;

import com.medledger.consentservice.collaborators.BlobNotFoundException;
import com.medledger.consentservice.collaborators.BlobStore;
import com.medledger.consentservice.configurations.ConsentEngineProperties;
import com.medledger.consentservice.exceptions.AuditFailureException;
import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.models.AccessDecision;
import com.medledger.consentservice.models.AccessLevel;
import com.medledger.consentservice.models.AuditEntry;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.DecisionReason;
import com.medledger.consentservice.models.MedicalRecord;
import com.medledger.consentservice.models.ResourceType;
import com.medledger.consentservice.models.details.AuditDetails;
import com.medledger.consentservice.models.details.RecordAccessDetails;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RecordAccessOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final byte[] CIPHERTEXT = {1, 2, 3, 4};

    private MedicalRecordService medicalRecordService;
    private AccessEvaluator accessEvaluator;
    private BlobStore blobStore;
    private AuditLedgerWriter auditWriter;
    private ThreadPoolTaskExecutor executor;
    private RecordAccessOrchestrator orchestrator;

    private final MedicalRecord record = MedicalRecord.builder()
            .recordId("record-1")
            .patientId("patient-1")
            .providerId("provider-0")
            .resourceType(ResourceType.LAB_RESULT)
            .contentHash("hash-1")
            .createdAt(NOW.minusSeconds(3600))
            .build();

    @BeforeEach
    void setUp() {
        medicalRecordService = mock(MedicalRecordService.class);
        accessEvaluator = mock(AccessEvaluator.class);
        blobStore = mock(BlobStore.class);
        auditWriter = mock(AuditLedgerWriter.class);

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setThreadNamePrefix("test-dependency-");
        executor.initialize();

        ConsentEngineProperties properties = new ConsentEngineProperties();
        DependencyCalls dependencyCalls = new DependencyCalls(executor, properties);
        orchestrator = new RecordAccessOrchestrator(medicalRecordService, accessEvaluator, blobStore,
                auditWriter, dependencyCalls, properties);

        when(auditWriter.append(eq(AuditEventType.RECORD_ACCESSED), anyString(), anyString(), any(), anyString()))
                .thenReturn(AuditEntry.builder().entryId("audit-1").build());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private RecordAccessDetails auditedDetails() {
        ArgumentCaptor<AuditDetails> details = ArgumentCaptor.forClass(AuditDetails.class);
        verify(auditWriter, times(1)).append(eq(AuditEventType.RECORD_ACCESSED), eq("provider-1"),
                eq("record-1"), details.capture(), eq("provider-1"));
        return (RecordAccessDetails) details.getValue();
    }

    private void recordExists() {
        when(medicalRecordService.findRecord("record-1")).thenReturn(Optional.of(record));
    }

    private void decision(AccessDecision decision) {
        when(accessEvaluator.evaluate("provider-1", "patient-1", ResourceType.LAB_RESULT, AccessLevel.READ, NOW))
                .thenReturn(decision);
    }

    @Nested
    @DisplayName("decided outcomes")
    class Decided {

        @Test
        void releasesCiphertextWhenConsentMatches() {
            recordExists();
            decision(AccessDecision.granted("token-1"));
            when(blobStore.get("hash-1")).thenReturn(CIPHERTEXT);

            RecordAccessResult result = orchestrator.accessRecord("record-1", "provider-1", NOW);

            assertEquals(RecordAccessResult.Outcome.GRANTED, result.getOutcome());
            assertArrayEquals(CIPHERTEXT, result.getCiphertext());
            assertEquals("token-1", result.getMatchedTokenId());
            assertEquals("audit-1", result.getAuditEntryId());

            RecordAccessDetails details = auditedDetails();
            assertEquals(RecordAccessDetails.OUTCOME_GRANTED, details.getOutcome());
            assertEquals("token-1", details.getMatchedTokenId());
            assertEquals("patient-1", details.getPatientId());
            assertEquals("lab_result", details.getResourceType());
        }

        @Test
        void deniesWithoutTouchingStorage() {
            recordExists();
            decision(AccessDecision.denied(DecisionReason.WRONG_ACCESS_LEVEL));

            RecordAccessResult result = orchestrator.accessRecord("record-1", "provider-1", NOW);

            assertEquals(RecordAccessResult.Outcome.DENIED, result.getOutcome());
            assertEquals(DecisionReason.WRONG_ACCESS_LEVEL, result.getReason());
            assertNull(result.getCiphertext());
            verifyNoInteractions(blobStore);

            RecordAccessDetails details = auditedDetails();
            assertEquals(RecordAccessDetails.OUTCOME_DENIED, details.getOutcome());
            assertEquals("WRONG_ACCESS_LEVEL", details.getReason());
        }

        @Test
        void auditsUnknownRecords() {
            when(medicalRecordService.findRecord("record-1")).thenReturn(Optional.empty());

            RecordAccessResult result = orchestrator.accessRecord("record-1", "provider-1", NOW);

            assertEquals(RecordAccessResult.Outcome.NOT_FOUND, result.getOutcome());
            verifyNoInteractions(accessEvaluator, blobStore);
            assertEquals(RecordAccessDetails.OUTCOME_NOT_FOUND, auditedDetails().getOutcome());
        }

        @Test
        void withholdsCiphertextWhenTheAuditFails() {
            recordExists();
            decision(AccessDecision.granted("token-1"));
            when(blobStore.get("hash-1")).thenReturn(CIPHERTEXT);
            when(auditWriter.append(eq(AuditEventType.RECORD_ACCESSED), anyString(), anyString(), any(), anyString()))
                    .thenThrow(new AuditFailureException("ledger down", null));

            assertThrows(AuditFailureException.class,
                    () -> orchestrator.accessRecord("record-1", "provider-1", NOW));
        }

        @Test
        void rejectsMissingIdentifiers() {
            assertThrows(BadRequestException.class, () -> orchestrator.accessRecord(" ", "provider-1", NOW));
            assertThrows(BadRequestException.class, () -> orchestrator.accessRecord("record-1", null, NOW));
            verifyNoInteractions(auditWriter);
        }
    }

    @Nested
    @DisplayName("dependency failures")
    class DependencyFailures {

        @Test
        void missingBlobIsStorageUnavailableNotDenied() {
            recordExists();
            decision(AccessDecision.granted("token-1"));
            when(blobStore.get("hash-1")).thenThrow(new BlobNotFoundException("hash-1"));

            RecordAccessResult result = orchestrator.accessRecord("record-1", "provider-1", NOW);

            assertEquals(RecordAccessResult.Outcome.STORAGE_UNAVAILABLE, result.getOutcome());
            assertTrue(result.getOutcome().isRetryable());
            assertEquals("token-1", result.getMatchedTokenId());
            assertNull(result.getCiphertext());
            assertEquals(RecordAccessDetails.OUTCOME_STORAGE_UNAVAILABLE, auditedDetails().getOutcome());
        }

        @Test
        void slowBlobStoreTimesOutAsStorageUnavailable() {
            recordExists();
            decision(AccessDecision.granted("token-1"));
            when(blobStore.get("hash-1")).thenAnswer(invocation -> {
                Thread.sleep(1000);
                return CIPHERTEXT;
            });

            RecordAccessResult result = orchestrator.accessRecord("record-1", "provider-1", NOW,
                    Duration.ofMillis(100));

            assertEquals(RecordAccessResult.Outcome.STORAGE_UNAVAILABLE, result.getOutcome());
            assertNull(result.getCiphertext());
        }

        @Test
        void slowConsentStoreIsUnavailableNotDenied() {
            recordExists();
            when(accessEvaluator.evaluate("provider-1", "patient-1", ResourceType.LAB_RESULT, AccessLevel.READ, NOW))
                    .thenAnswer(invocation -> {
                        Thread.sleep(1000);
                        return AccessDecision.granted("token-1");
                    });

            RecordAccessResult result = orchestrator.accessRecord("record-1", "provider-1", NOW,
                    Duration.ofMillis(100));

            assertEquals(RecordAccessResult.Outcome.UNAVAILABLE, result.getOutcome());
            assertNull(result.getReason());
            verifyNoInteractions(blobStore);

            RecordAccessDetails details = auditedDetails();
            assertEquals(RecordAccessDetails.OUTCOME_UNAVAILABLE, details.getOutcome());
            assertEquals("consent-store", details.getReason());
        }

        @Test
        void failingMetadataLookupIsUnavailable() {
            when(medicalRecordService.findRecord("record-1")).thenThrow(new IllegalStateException("db down"));

            RecordAccessResult result = orchestrator.accessRecord("record-1", "provider-1", NOW);

            assertEquals(RecordAccessResult.Outcome.UNAVAILABLE, result.getOutcome());
            verify(accessEvaluator, never()).evaluate(anyString(), anyString(), any(), any(), any());
            RecordAccessDetails details = auditedDetails();
            assertEquals("record-metadata", details.getReason());
            assertNull(details.getPatientId());
        }
    }
}
