package com.medledger.consentservice.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Metadata of an encrypted medical record. The ciphertext itself lives in the blob store
 * under {@code contentHash}.
 */
@Entity
@Table(name = "medical_records", indexes = {
        @Index(name = "idx_record_patient", columnList = "patientId"),
        @Index(name = "idx_record_provider", columnList = "providerId")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MedicalRecord {

    @Id
    @Column(length = 64)
    private String recordId;

    @Column(nullable = false, updatable = false, length = 100)
    private String patientId;

    @Column(nullable = false, updatable = false, length = 100)
    private String providerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private ResourceType resourceType;

    @Column(nullable = false, updatable = false, length = 128)
    private String contentHash;

    @Column(length = 200)
    private String title;

    @Column(length = 1000)
    private String description;

    @Column(length = 100)
    private String mimeType;

    private Long fileSize;

    @Column(length = 128)
    private String encryptionKeyHash;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
