package com.medledger.consentservice.models;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A signed, optionally time-bounded grant of permissions from a patient to a provider.
 * Parties and permissions never change after creation; only revocation mutates a token.
 */
@Entity
@Table(name = "consent_tokens", indexes = {
        @Index(name = "idx_consent_pair", columnList = "patientId, providerId"),
        @Index(name = "idx_consent_provider", columnList = "providerId")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsentToken {

    @Id
    @Column(length = 64)
    private String tokenId;

    @Column(nullable = false, updatable = false, length = 100)
    private String patientId;

    @Column(nullable = false, updatable = false, length = 100)
    private String providerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "consent_token_permissions", joinColumns = @JoinColumn(name = "token_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<ConsentPermission> permissions = new ArrayList<>();

    @Column(updatable = false)
    private Instant expirationTime;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant revokedAt;

    @Column(length = 100)
    private String revokedBy;

    @Column(nullable = false, updatable = false, length = 1024)
    private String patientSignature;

    @Column(length = 1024)
    private String revocationSignature;

    @Version
    private Long version;

    /**
     * Lazy expiration: a token is expired once {@code now} reaches its expiration time,
     * whether or not anything has flipped the active flag.
     */
    public boolean isExpiredAt(Instant now) {
        return expirationTime != null && !now.isBefore(expirationTime);
    }

    public boolean isLiveAt(Instant now) {
        return active && !isExpiredAt(now);
    }

    public boolean grants(ResourceType resourceType, AccessLevel accessLevel) {
        return permissions.stream().anyMatch(p -> p.matches(resourceType, accessLevel));
    }

    public boolean coversResourceType(ResourceType resourceType) {
        return permissions.stream().anyMatch(p -> p.getResourceType() == resourceType);
    }
}
