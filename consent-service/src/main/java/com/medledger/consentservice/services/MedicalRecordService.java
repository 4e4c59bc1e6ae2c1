package com.medledger.consentservice.services;

import com.medledger.consentservice.collaborators.BlobStore;
import com.medledger.consentservice.configurations.CacheConfig;
import com.medledger.consentservice.configurations.ConsentEngineProperties;
import com.medledger.consentservice.exceptions.AccessDeniedException;
import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.exceptions.ForbiddenException;
import com.medledger.consentservice.exceptions.ResourceNotFoundException;
import com.medledger.consentservice.models.AccessDecision;
import com.medledger.consentservice.models.AccessLevel;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.DecisionReason;
import com.medledger.consentservice.models.MedicalRecord;
import com.medledger.consentservice.models.ResourceType;
import com.medledger.consentservice.models.UserRole;
import com.medledger.consentservice.models.details.RecordAccessDetails;
import com.medledger.consentservice.models.details.RecordCreatedDetails;
import com.medledger.consentservice.repository.MedicalRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Upload and metadata side of medical records. Uploads are consent-gated with {@code write}
 * unless the patient uploads their own record, and every upload decision is audited.
 */
@Service
@Slf4j
public class MedicalRecordService {

    private final MedicalRecordRepository medicalRecords;
    private final BlobStore blobStore;
    private final AccessEvaluator accessEvaluator;
    private final AuditLedgerWriter auditWriter;
    private final DependencyCalls dependencyCalls;
    private final ConsentEngineProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public MedicalRecordService(MedicalRecordRepository medicalRecords,
                                BlobStore blobStore,
                                AccessEvaluator accessEvaluator,
                                AuditLedgerWriter auditWriter,
                                DependencyCalls dependencyCalls,
                                ConsentEngineProperties properties,
                                Clock clock,
                                PlatformTransactionManager transactionManager) {
        this.medicalRecords = medicalRecords;
        this.blobStore = blobStore;
        this.accessEvaluator = accessEvaluator;
        this.auditWriter = auditWriter;
        this.dependencyCalls = dependencyCalls;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Stores the ciphertext and its metadata.
     *
     * @throws AccessDeniedException when a provider uploads without write consent; the denial is audited
     */
    public MedicalRecord createRecord(CreateRecordCommand command) {
        validate(command);
        Instant now = clock.instant();
        String uploaderId = command.getUploaderId();
        String patientId = command.getPatientId();

        String matchedTokenId = null;
        if (!uploaderId.equals(patientId)) {
            AccessDecision decision = accessEvaluator.evaluate(uploaderId, patientId,
                    command.getResourceType(), AccessLevel.WRITE, now);
            if (!decision.isGranted()) {
                RecordCreatedDetails denied = RecordCreatedDetails.builder()
                        .outcome(RecordAccessDetails.OUTCOME_DENIED)
                        .reason(decision.getReason().name())
                        .patientId(patientId)
                        .resourceType(command.getResourceType().getValue())
                        .build();
                auditWriter.append(AuditEventType.RECORD_CREATED, uploaderId, null, denied, uploaderId);
                log.warn("Upload by {} for patient {} denied: {}", uploaderId, patientId, decision.getReason());
                throw new AccessDeniedException("No write consent for " + command.getResourceType().getValue(),
                        decision.getReason());
            }
            matchedTokenId = decision.getMatchedTokenId();
        }

        // Content-addressed, so a put whose transaction later rolls back leaves only an unreferenced blob.
        String contentHash = dependencyCalls.call("blob-store", () -> blobStore.put(command.getCiphertext()));
        String tokenId = matchedTokenId;

        MedicalRecord saved = transactionTemplate.execute(status -> {
            MedicalRecord record = MedicalRecord.builder()
                    .recordId(UUID.randomUUID().toString())
                    .patientId(patientId)
                    .providerId(uploaderId)
                    .resourceType(command.getResourceType())
                    .contentHash(contentHash)
                    .title(command.getTitle())
                    .description(command.getDescription())
                    .mimeType(command.getMimeType())
                    .fileSize((long) command.getCiphertext().length)
                    .encryptionKeyHash(command.getEncryptionKeyHash())
                    .createdAt(now.truncatedTo(ChronoUnit.MICROS))
                    .build();
            MedicalRecord persisted = medicalRecords.saveAndFlush(record);

            RecordCreatedDetails details = RecordCreatedDetails.builder()
                    .outcome(RecordAccessDetails.OUTCOME_GRANTED)
                    .patientId(patientId)
                    .resourceType(command.getResourceType().getValue())
                    .contentHash(contentHash)
                    .matchedTokenId(tokenId)
                    .build();
            auditWriter.append(AuditEventType.RECORD_CREATED, uploaderId, persisted.getRecordId(), details, uploaderId);
            return persisted;
        });

        log.info("Record {} ({}) created for patient {} by {}",
                saved.getRecordId(), saved.getResourceType().getValue(), patientId, uploaderId);
        return saved;
    }

    /**
     * Metadata lookup used on the access path. Misses are not cached.
     */
    @Cacheable(cacheNames = CacheConfig.RECORD_METADATA_CACHE, unless = "#result == null")
    public Optional<MedicalRecord> findRecord(String recordId) {
        return medicalRecords.findById(recordId);
    }

    /**
     * Metadata for a requester who is the patient or holds read consent for the record's type.
     */
    public MedicalRecord getMetadata(String recordId, String requesterId, Instant now) {
        MedicalRecord record = medicalRecords.findById(recordId).orElse(null);
        if (record == null) {
            if (properties.getAccess().isCollapseNotFound()) {
                throw new AccessDeniedException("Access to record " + recordId + " denied", DecisionReason.NO_CONSENT);
            }
            throw new ResourceNotFoundException("Record not found: " + recordId);
        }
        if (!record.getPatientId().equals(requesterId)) {
            AccessDecision decision = accessEvaluator.evaluate(requesterId, record.getPatientId(),
                    record.getResourceType(), AccessLevel.READ, now);
            if (!decision.isGranted()) {
                throw new AccessDeniedException("Access to record " + recordId + " denied", decision.getReason());
            }
        }
        return record;
    }

    public List<MedicalRecord> listPatientRecords(String patientId, String requesterId, UserRole role) {
        if (!patientId.equals(requesterId) && role != UserRole.ADMIN) {
            throw new ForbiddenException("Only the patient or an administrator may list these records");
        }
        return medicalRecords.findByPatientIdOrderByCreatedAtAsc(patientId);
    }

    /**
     * Records uploaded by a provider. Only that provider or an administrator may list them.
     */
    public List<MedicalRecord> listProviderRecords(String providerId, String requesterId, UserRole role) {
        if (!providerId.equals(requesterId) && role != UserRole.ADMIN) {
            log.warn("User {} attempted to list records uploaded by {}", requesterId, providerId);
            throw new ForbiddenException("Only the provider or an administrator may list these records");
        }
        return medicalRecords.findByProviderIdOrderByCreatedAtAsc(providerId);
    }

    /**
     * Records of one type. Without a patient filter only administrators may query; with one,
     * the patient, an administrator or a provider holding read consent for the type.
     */
    public List<MedicalRecord> queryByType(ResourceType resourceType, String patientId, String requesterId,
                                           UserRole role, Instant now) {
        if (resourceType == null) {
            throw new BadRequestException("resourceType is required");
        }
        if (patientId == null || patientId.isBlank()) {
            if (role != UserRole.ADMIN) {
                throw new ForbiddenException("Only an administrator may query records across patients");
            }
            return medicalRecords.findByResourceTypeOrderByCreatedAtAsc(resourceType);
        }
        if (!patientId.equals(requesterId) && role != UserRole.ADMIN) {
            AccessDecision decision = accessEvaluator.evaluate(requesterId, patientId, resourceType, AccessLevel.READ, now);
            if (!decision.isGranted()) {
                log.warn("User {} denied {} records of patient {}: {}", requesterId, resourceType.getValue(),
                        patientId, decision.getReason());
                throw new AccessDeniedException("No read consent for " + resourceType.getValue(), decision.getReason());
            }
        }
        return medicalRecords.findByPatientIdAndResourceTypeOrderByCreatedAtAsc(patientId, resourceType);
    }

    private void validate(CreateRecordCommand command) {
        if (command.getUploaderId() == null || command.getUploaderId().isBlank()) {
            throw new BadRequestException("uploaderId is required");
        }
        if (command.getPatientId() == null || command.getPatientId().isBlank()) {
            throw new BadRequestException("patientId is required");
        }
        if (command.getResourceType() == null) {
            throw new BadRequestException("resourceType is required");
        }
        if (command.getCiphertext() == null || command.getCiphertext().length == 0) {
            throw new BadRequestException("Encrypted content is required");
        }
    }
}
