package com.medledger.consentservice.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * One link of the audit hash chain. Rows are written once and never updated.
 */
@Entity
@Immutable
@Table(name = "audit_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_audit_block_number", columnNames = "blockNumber"),
        indexes = {
                @Index(name = "idx_audit_user", columnList = "userId"),
                @Index(name = "idx_audit_timestamp", columnList = "timestamp")
        })
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditEntry {

    @Id
    @Column(length = 64)
    private String entryId;

    @Column(nullable = false)
    private Long blockNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AuditEventType eventType;

    @Column(nullable = false, length = 100)
    private String userId;

    @Column(length = 100)
    private String resourceId;

    @Column(nullable = false)
    private Instant timestamp;

    // Canonical JSON of the typed details; hashed exactly as stored.
    @Column(name = "details", nullable = false, length = 8000)
    private String detailsJson;

    @Column(nullable = false, length = 64)
    private String previousHash;

    @Column(nullable = false, length = 64)
    private String entryHash;

    @Column(nullable = false, length = 1024)
    private String signature;

    @Column(nullable = false, length = 100)
    private String signerKeyRef;

    @Column(length = 100)
    private String transactionId;
}
