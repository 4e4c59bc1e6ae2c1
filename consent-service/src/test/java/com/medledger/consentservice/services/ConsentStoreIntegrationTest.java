package com.medledger.consentservice.services;

import com.medledger.consentservice.collaborators.SignatureProvider;
import com.medledger.consentservice.exceptions.AlreadyRevokedException;
import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.exceptions.ForbiddenException;
import com.medledger.consentservice.exceptions.InvalidExpirationException;
import com.medledger.consentservice.exceptions.ResourceNotFoundException;
import com.medledger.consentservice.models.AccessDecision;
import com.medledger.consentservice.models.AccessLevel;
import com.medledger.consentservice.models.AuditEntry;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.ConsentPermission;
import com.medledger.consentservice.models.ConsentToken;
import com.medledger.consentservice.models.DecisionReason;
import com.medledger.consentservice.models.ResourceType;
import com.medledger.consentservice.repository.AuditEntryRepository;
import com.medledger.consentservice.repository.ConsentTokenRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static com.medledger.consentservice.services.ConsentFixtures.permission;
import static com.medledger.consentservice.services.ConsentFixtures.permissions;
import static com.medledger.consentservice.services.ConsentFixtures.sign;
import static com.medledger.consentservice.services.ConsentFixtures.uniqueId;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class ConsentStoreIntegrationTest {

    @Autowired
    private ConsentStore consentStore;

    @Autowired
    private AccessEvaluator accessEvaluator;

    @Autowired
    private SignatureProvider signatureProvider;

    @Autowired
    private ConsentTokenRepository consentTokens;

    @Autowired
    private AuditEntryRepository auditEntries;

    private ConsentToken grant(String patientId, String providerId, List<ConsentPermission> permissions,
                               Instant expirationTime) {
        return consentStore.grant(patientId, providerId, permissions, expirationTime,
                sign(signatureProvider, patientId, providerId, permissions, expirationTime));
    }

    private AccessDecision evaluate(String providerId, String patientId, ResourceType resourceType, AccessLevel accessLevel) {
        return accessEvaluator.evaluate(providerId, patientId, resourceType, accessLevel, Instant.now());
    }

    @Nested
    @DisplayName("grant")
    class Grant {

        @Test
        void persistsTokenAndAuditsIt() {
            String patient = uniqueId("patient");
            String provider = uniqueId("provider");

            ConsentToken token = grant(patient, provider,
                    permissions(permission(ResourceType.DIAGNOSIS, AccessLevel.READ)), null);

            assertTrue(token.isActive());
            assertNotNull(token.getCreatedAt());
            assertTrue(consentTokens.findById(token.getTokenId()).isPresent());

            List<AuditEntry> audit = auditEntries.findByResourceIdOrderByBlockNumberAsc(token.getTokenId());
            assertEquals(1, audit.size());
            assertEquals(AuditEventType.CONSENT_GRANTED, audit.get(0).getEventType());
            assertEquals(patient, audit.get(0).getUserId());
            assertNotNull(audit.get(0).getTransactionId());
        }

        @Test
        void removesDuplicatePermissionsKeepingFirstOccurrence() {
            String patient = uniqueId("patient");
            String provider = uniqueId("provider");

            ConsentToken token = grant(patient, provider, permissions(
                    permission(ResourceType.IMAGING, AccessLevel.READ),
                    permission(ResourceType.DIAGNOSIS, AccessLevel.WRITE),
                    permission(ResourceType.IMAGING, AccessLevel.READ)), null);

            ConsentToken stored = consentStore.get(token.getTokenId());
            assertEquals(List.of(permission(ResourceType.IMAGING, AccessLevel.READ),
                    permission(ResourceType.DIAGNOSIS, AccessLevel.WRITE)), stored.getPermissions());
        }

        @Test
        void verifiesThePermissionsAsSubmittedNotTheDeduplicatedList() {
            String patient = uniqueId("patient");
            String provider = uniqueId("provider");
            List<ConsentPermission> submitted = permissions(
                    permission(ResourceType.IMAGING, AccessLevel.READ),
                    permission(ResourceType.IMAGING, AccessLevel.READ));
            List<ConsentPermission> deduplicated = permissions(permission(ResourceType.IMAGING, AccessLevel.READ));
            String signatureOverDeduplicated = sign(signatureProvider, patient, provider, deduplicated, null);

            assertThrows(ForbiddenException.class,
                    () -> consentStore.grant(patient, provider, submitted, null, signatureOverDeduplicated));
            assertTrue(consentStore.listByPatient(patient).isEmpty());
        }

        @Test
        void rejectsExpirationInThePastWithoutWriting() {
            String patient = uniqueId("patient");
            String provider = uniqueId("provider");
            Instant past = Instant.now().minusSeconds(5).truncatedTo(ChronoUnit.MILLIS);
            List<ConsentPermission> permissions = permissions(permission(ResourceType.DIAGNOSIS, AccessLevel.READ));

            assertThrows(InvalidExpirationException.class, () -> grant(patient, provider, permissions, past));
            assertTrue(consentStore.listByPatient(patient).isEmpty());
        }

        @Test
        void rejectsEmptyPermissions() {
            assertThrows(BadRequestException.class, () -> consentStore.grant(uniqueId("patient"),
                    uniqueId("provider"), List.of(), null, "sig"));
        }

        @Test
        void rejectsSignatureMadeForAnotherPayload() {
            String patient = uniqueId("patient");
            String provider = uniqueId("provider");
            List<ConsentPermission> signed = permissions(permission(ResourceType.DIAGNOSIS, AccessLevel.READ));
            List<ConsentPermission> requested = permissions(permission(ResourceType.DIAGNOSIS, AccessLevel.WRITE));
            String signature = sign(signatureProvider, patient, provider, signed, null);

            assertThrows(ForbiddenException.class,
                    () -> consentStore.grant(patient, provider, requested, null, signature));
            assertTrue(consentStore.listByPatient(patient).isEmpty());
        }

        @Test
        void keepsCreationTimesStrictlyIncreasingPerPair() {
            String patient = uniqueId("patient");
            String provider = uniqueId("provider");
            List<ConsentPermission> permissions = permissions(permission(ResourceType.DIAGNOSIS, AccessLevel.READ));

            for (int i = 0; i < 5; i++) {
                grant(patient, provider, permissions, null);
            }

            List<ConsentToken> tokens = consentStore.listByPatient(patient);
            assertEquals(5, tokens.size());
            for (int i = 1; i < tokens.size(); i++) {
                assertTrue(tokens.get(i).getCreatedAt().isAfter(tokens.get(i - 1).getCreatedAt()));
            }
        }
    }

    @Nested
    @DisplayName("revoke")
    class Revoke {

        @Test
        void revokedConsentIsDeniedImmediately() {
            String patient = uniqueId("patient");
            String provider = uniqueId("provider");
            ConsentToken token = grant(patient, provider,
                    permissions(permission(ResourceType.LAB_RESULT, AccessLevel.READ)), null);
            assertTrue(evaluate(provider, patient, ResourceType.LAB_RESULT, AccessLevel.READ).isGranted());

            RevocationResult result = consentStore.revoke(token.getTokenId(), patient, "revocation-sig");

            assertNotNull(result.getRevokedAt());
            AccessDecision after = evaluate(provider, patient, ResourceType.LAB_RESULT, AccessLevel.READ);
            assertFalse(after.isGranted());
            assertEquals(DecisionReason.NO_CONSENT, after.getReason());
            assertEquals(DecisionReason.REVOKED, accessEvaluator.evaluateToken(token.getTokenId(), provider,
                    ResourceType.LAB_RESULT, AccessLevel.READ, Instant.now()).getReason());
        }

        @Test
        void secondRevokeFailsWithoutAnotherAuditEntry() {
            String patient = uniqueId("patient");
            String provider = uniqueId("provider");
            ConsentToken token = grant(patient, provider,
                    permissions(permission(ResourceType.DIAGNOSIS, AccessLevel.READ)), null);

            consentStore.revoke(token.getTokenId(), patient, "sig-1");
            assertThrows(AlreadyRevokedException.class,
                    () -> consentStore.revoke(token.getTokenId(), patient, "sig-2"));

            List<AuditEntry> audit = auditEntries.findByResourceIdOrderByBlockNumberAsc(token.getTokenId());
            assertEquals(List.of(AuditEventType.CONSENT_GRANTED, AuditEventType.CONSENT_REVOKED),
                    audit.stream().map(AuditEntry::getEventType).toList());

            ConsentToken stored = consentStore.get(token.getTokenId());
            assertFalse(stored.isActive());
            assertEquals("sig-1", stored.getRevocationSignature());
            assertFalse(stored.getRevokedAt().isBefore(stored.getCreatedAt()));
        }

        @Test
        void unknownTokenIsNotFound() {
            assertThrows(ResourceNotFoundException.class,
                    () -> consentStore.revoke(uniqueId("token"), "patient", "sig"));
        }
    }

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        void grantThenRevokeScenario() {
            String patient = uniqueId("patient");
            String provider = uniqueId("provider");
            Instant expiration = Instant.now().plus(30, ChronoUnit.DAYS).truncatedTo(ChronoUnit.MILLIS);
            ConsentToken token = grant(patient, provider, permissions(
                    permission(ResourceType.LAB_RESULT, AccessLevel.READ),
                    permission(ResourceType.DIAGNOSIS, AccessLevel.READ)), expiration);

            AccessDecision labRead = evaluate(provider, patient, ResourceType.LAB_RESULT, AccessLevel.READ);
            assertTrue(labRead.isGranted());
            assertEquals(token.getTokenId(), labRead.getMatchedTokenId());
            assertEquals(DecisionReason.WRONG_ACCESS_LEVEL,
                    evaluate(provider, patient, ResourceType.LAB_RESULT, AccessLevel.WRITE).getReason());
            assertEquals(DecisionReason.WRONG_RESOURCE_TYPE,
                    evaluate(provider, patient, ResourceType.IMAGING, AccessLevel.READ).getReason());

            consentStore.revoke(token.getTokenId(), patient, "sig");

            assertEquals(DecisionReason.NO_CONSENT,
                    evaluate(provider, patient, ResourceType.LAB_RESULT, AccessLevel.READ).getReason());
        }

        @Test
        void shortLivedConsentExpiresWithoutAnySweep() throws InterruptedException {
            String patient = uniqueId("patient");
            String provider = uniqueId("provider");
            Instant expiration = Instant.now().plusSeconds(1).truncatedTo(ChronoUnit.MILLIS);
            grant(patient, provider, permissions(permission(ResourceType.PRESCRIPTION, AccessLevel.READ)), expiration);

            assertTrue(accessEvaluator.evaluate(provider, patient, ResourceType.PRESCRIPTION, AccessLevel.READ,
                    expiration.minusMillis(1)).isGranted());

            Thread.sleep(1500);

            AccessDecision decision = evaluate(provider, patient, ResourceType.PRESCRIPTION, AccessLevel.READ);
            assertFalse(decision.isGranted());
            assertEquals(DecisionReason.EXPIRED, decision.getReason());
            assertTrue(consentStore.findActiveGrants(patient, provider).isEmpty());
        }

        @Test
        void listsAreOrderedByCreationTime() {
            String patient = uniqueId("patient");
            String providerA = uniqueId("provider");
            String providerB = uniqueId("provider");
            List<ConsentPermission> permissions = permissions(permission(ResourceType.IMAGING, AccessLevel.READ));

            ConsentToken first = grant(patient, providerA, permissions, null);
            ConsentToken second = grant(patient, providerB, permissions, null);
            ConsentToken third = grant(patient, providerA, permissions, null);

            assertEquals(List.of(first.getTokenId(), second.getTokenId(), third.getTokenId()),
                    consentStore.listByPatient(patient).stream().map(ConsentToken::getTokenId).toList());
            assertEquals(List.of(first.getTokenId(), third.getTokenId()),
                    consentStore.listByProvider(providerA).stream().map(ConsentToken::getTokenId).toList());
        }
    }
}
