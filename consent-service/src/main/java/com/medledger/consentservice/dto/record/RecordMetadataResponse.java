package com.medledger.consentservice.dto.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medledger.consentservice.models.MedicalRecord;
import com.medledger.consentservice.models.ResourceType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@Builder
public class RecordMetadataResponse {

    private String recordId;
    private String patientId;
    private String providerId;
    private ResourceType resourceType;
    private String contentHash;
    private String title;
    private String description;
    private String mimeType;
    private Long fileSize;
    private String encryptionKeyHash;
    private Instant createdAt;

    public static RecordMetadataResponse from(MedicalRecord record) {
        return RecordMetadataResponse.builder()
                .recordId(record.getRecordId())
                .patientId(record.getPatientId())
                .providerId(record.getProviderId())
                .resourceType(record.getResourceType())
                .contentHash(record.getContentHash())
                .title(record.getTitle())
                .description(record.getDescription())
                .mimeType(record.getMimeType())
                .fileSize(record.getFileSize())
                .encryptionKeyHash(record.getEncryptionKeyHash())
                .createdAt(record.getCreatedAt())
                .build();
    }
}
