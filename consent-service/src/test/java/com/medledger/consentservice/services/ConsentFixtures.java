package com.medledger.consentservice.services;

import com.medledger.consentservice.collaborators.SignatureProvider;
import com.medledger.consentservice.models.AccessLevel;
import com.medledger.consentservice.models.ConsentPermission;
import com.medledger.consentservice.models.ConsentToken;
import com.medledger.consentservice.models.ResourceType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Shared builders for consent tests.
 */
final class ConsentFixtures {

    private ConsentFixtures() {
    }

    static String uniqueId(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    static ConsentPermission permission(ResourceType resourceType, AccessLevel accessLevel) {
        return new ConsentPermission(resourceType, accessLevel);
    }

    static List<ConsentPermission> permissions(ConsentPermission... permissions) {
        return new ArrayList<>(Arrays.asList(permissions));
    }

    static String sign(SignatureProvider signatureProvider, String patientId, String providerId,
                       List<ConsentPermission> permissions, Instant expirationTime) {
        return signatureProvider.sign(patientId,
                ConsentGrantPayload.bytes(patientId, providerId, permissions, expirationTime));
    }

    static ConsentToken token(String tokenId, Instant createdAt, Instant expirationTime, boolean active,
                              ConsentPermission... permissions) {
        return ConsentToken.builder()
                .tokenId(tokenId)
                .patientId("patient-1")
                .providerId("provider-1")
                .permissions(permissions(permissions))
                .createdAt(createdAt)
                .expirationTime(expirationTime)
                .active(active)
                .patientSignature("sig")
                .build();
    }
}
