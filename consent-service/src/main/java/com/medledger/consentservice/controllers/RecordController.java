package com.medledger.consentservice.controllers;

import com.medledger.consentservice.annotations.RateLimited;
import com.medledger.consentservice.configurations.ConsentEngineProperties;
import com.medledger.consentservice.dto.record.CreateRecordRequest;
import com.medledger.consentservice.dto.record.RecordAccessResponse;
import com.medledger.consentservice.dto.record.RecordMetadataResponse;
import com.medledger.consentservice.exceptions.AccessDeniedException;
import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.exceptions.DependencyUnavailableException;
import com.medledger.consentservice.exceptions.ErrorKind;
import com.medledger.consentservice.exceptions.ResourceNotFoundException;
import com.medledger.consentservice.models.DecisionReason;
import com.medledger.consentservice.models.MedicalRecord;
import com.medledger.consentservice.models.ResourceType;
import com.medledger.consentservice.models.UserRole;
import com.medledger.consentservice.services.CreateRecordCommand;
import com.medledger.consentservice.services.MedicalRecordService;
import com.medledger.consentservice.services.RecordAccessOrchestrator;
import com.medledger.consentservice.services.RecordAccessResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/records")
@RequiredArgsConstructor
public class RecordController {

    private final RecordAccessOrchestrator accessOrchestrator;
    private final MedicalRecordService medicalRecordService;
    private final ConsentEngineProperties properties;
    private final Clock clock;

    /**
     * Upload an encrypted record. Providers need write consent for the resource type.
     */
    @PostMapping
    @RateLimited(maxRequests = 30, windowSeconds = 60, message = "Too many uploads. Please wait a minute.")
    public ResponseEntity<RecordMetadataResponse> createRecord(@RequestHeader("X-User-Id") String userId,
                                                               @Valid @RequestBody CreateRecordRequest request) {
        byte[] ciphertext;
        try {
            ciphertext = Base64.getDecoder().decode(request.getCiphertext());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("ciphertext must be Base64 encoded");
        }
        MedicalRecord record = medicalRecordService.createRecord(CreateRecordCommand.builder()
                .uploaderId(userId)
                .patientId(request.getPatientId())
                .resourceType(request.getResourceType())
                .title(request.getTitle())
                .description(request.getDescription())
                .mimeType(request.getMimeType())
                .encryptionKeyHash(request.getEncryptionKeyHash())
                .ciphertext(ciphertext)
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(RecordMetadataResponse.from(record));
    }

    /**
     * Fetch a record's ciphertext under the caller's consent. Every call is audited.
     */
    @GetMapping("/{recordId}/access")
    @RateLimited(maxRequests = 60, windowSeconds = 60, message = "Too many record requests. Please wait a minute.")
    public ResponseEntity<RecordAccessResponse> accessRecord(@RequestHeader("X-User-Id") String userId,
                                                             @PathVariable String recordId) {
        RecordAccessResult result = accessOrchestrator.accessRecord(recordId, userId, clock.instant());
        switch (result.getOutcome()) {
            case GRANTED:
                return ResponseEntity.ok(RecordAccessResponse.builder()
                        .success(true)
                        .recordId(recordId)
                        .matchedTokenId(result.getMatchedTokenId())
                        .metadata(RecordMetadataResponse.from(result.getRecord()))
                        .ciphertext(Base64.getEncoder().encodeToString(result.getCiphertext()))
                        .auditEntryId(result.getAuditEntryId())
                        .build());
            case NOT_FOUND:
                if (properties.getAccess().isCollapseNotFound()) {
                    throw denied(recordId, DecisionReason.NO_CONSENT);
                }
                throw new ResourceNotFoundException("Record not found: " + recordId);
            case DENIED:
                throw denied(recordId, result.getReason());
            case STORAGE_UNAVAILABLE:
                throw new DependencyUnavailableException(ErrorKind.STORAGE_UNAVAILABLE, "blob-store",
                        "ciphertext for record " + recordId + " could not be fetched", null);
            default:
                throw new DependencyUnavailableException("consent-engine", result.getFailure(), null);
        }
    }

    @GetMapping("/{recordId}")
    public ResponseEntity<RecordMetadataResponse> getMetadata(@RequestHeader("X-User-Id") String userId,
                                                              @PathVariable String recordId) {
        MedicalRecord record = medicalRecordService.getMetadata(recordId, userId, clock.instant());
        return ResponseEntity.ok(RecordMetadataResponse.from(record));
    }

    @GetMapping("/patient/{patientId}")
    public ResponseEntity<List<RecordMetadataResponse>> listPatientRecords(
            @RequestHeader("X-User-Id") String userId,
            @RequestHeader(value = "X-User-Role", required = false) String role,
            @PathVariable String patientId) {
        List<MedicalRecord> records = medicalRecordService.listPatientRecords(patientId, userId, UserRole.fromHeader(role));
        return ResponseEntity.ok(records.stream().map(RecordMetadataResponse::from).collect(Collectors.toList()));
    }

    @GetMapping("/provider/{providerId}")
    public ResponseEntity<List<RecordMetadataResponse>> listProviderRecords(
            @RequestHeader("X-User-Id") String userId,
            @RequestHeader(value = "X-User-Role", required = false) String role,
            @PathVariable String providerId) {
        List<MedicalRecord> records = medicalRecordService.listProviderRecords(providerId, userId, UserRole.fromHeader(role));
        return ResponseEntity.ok(records.stream().map(RecordMetadataResponse::from).collect(Collectors.toList()));
    }

    /**
     * Records of one type, optionally limited to one patient.
     */
    @GetMapping("/query/type/{resourceType}")
    public ResponseEntity<List<RecordMetadataResponse>> queryByType(
            @RequestHeader("X-User-Id") String userId,
            @RequestHeader(value = "X-User-Role", required = false) String role,
            @PathVariable ResourceType resourceType,
            @RequestParam(required = false) String patientId) {
        List<MedicalRecord> records = medicalRecordService.queryByType(resourceType, patientId, userId,
                UserRole.fromHeader(role), clock.instant());
        return ResponseEntity.ok(records.stream().map(RecordMetadataResponse::from).collect(Collectors.toList()));
    }

    // Missing records and missing consent read the same to the caller.
    private AccessDeniedException denied(String recordId, DecisionReason reason) {
        return new AccessDeniedException("Access to record " + recordId + " denied", reason);
    }
}
