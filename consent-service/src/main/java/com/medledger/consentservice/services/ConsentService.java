package com.medledger.consentservice.services;

import com.medledger.consentservice.exceptions.ForbiddenException;
import com.medledger.consentservice.models.AccessDecision;
import com.medledger.consentservice.models.AccessLevel;
import com.medledger.consentservice.models.ConsentPermission;
import com.medledger.consentservice.models.ConsentToken;
import com.medledger.consentservice.models.ResourceType;
import com.medledger.consentservice.models.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Applies caller identity to consent operations: only a patient grants their own consent,
 * only the patient or an administrator revokes it, and only the parties see a token or ask
 * whether it grants access.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsentService {

    private final ConsentStore consentStore;
    private final AccessEvaluator accessEvaluator;
    private final Clock clock;

    public ConsentToken grantConsent(String requesterId, String patientId, String providerId,
                                     List<ConsentPermission> permissions, Instant expirationTime,
                                     String patientSignature) {
        if (!patientId.equals(requesterId)) {
            log.warn("User {} attempted to grant consent on behalf of patient {}", requesterId, patientId);
            throw new ForbiddenException("Consent can only be granted by the patient");
        }
        return consentStore.grant(patientId, providerId, permissions, expirationTime, patientSignature);
    }

    public RevocationResult revokeConsent(String requesterId, UserRole role, String tokenId, String requesterSignature) {
        ConsentToken token = consentStore.get(tokenId);
        if (!token.getPatientId().equals(requesterId) && role != UserRole.ADMIN) {
            log.warn("User {} attempted to revoke consent {} owned by {}", requesterId, tokenId, token.getPatientId());
            throw new ForbiddenException("Consent can only be revoked by the patient or an administrator");
        }
        return consentStore.revoke(tokenId, requesterId, requesterSignature);
    }

    public ConsentToken getConsent(String requesterId, UserRole role, String tokenId) {
        ConsentToken token = consentStore.get(tokenId);
        if (!isParty(token, requesterId) && !isPrivileged(role)) {
            throw new ForbiddenException("Not a party to consent " + tokenId);
        }
        return token;
    }

    public List<ConsentToken> listForPatient(String requesterId, UserRole role, String patientId) {
        if (!patientId.equals(requesterId) && !isPrivileged(role)) {
            throw new ForbiddenException("Only the patient may list their consents");
        }
        return consentStore.listByPatient(patientId);
    }

    public List<ConsentToken> listForProvider(String requesterId, UserRole role, String providerId) {
        if (!providerId.equals(requesterId) && !isPrivileged(role)) {
            throw new ForbiddenException("Only the provider may list consents granted to them");
        }
        return consentStore.listByProvider(providerId);
    }

    public ConsentStatusSummary status(String requesterId, UserRole role, String patientId, String providerId) {
        if (!patientId.equals(requesterId) && !providerId.equals(requesterId) && !isPrivileged(role)) {
            throw new ForbiddenException("Not a party to this consent relationship");
        }
        Instant now = clock.instant();
        List<ConsentToken> tokens = consentStore.listByPair(patientId, providerId);

        int active = 0;
        int revoked = 0;
        int expired = 0;
        Map<String, Set<String>> effective = new TreeMap<>();
        for (ConsentToken token : tokens) {
            if (!token.isActive()) {
                revoked++;
            } else if (token.isExpiredAt(now)) {
                expired++;
            } else {
                active++;
                for (ConsentPermission permission : token.getPermissions()) {
                    effective.computeIfAbsent(permission.getResourceType().getValue(), k -> new TreeSet<>())
                            .add(permission.getAccessLevel().getValue());
                }
            }
        }
        return ConsentStatusSummary.builder()
                .patientId(patientId)
                .providerId(providerId)
                .totalGrants(tokens.size())
                .activeGrants(active)
                .revokedGrants(revoked)
                .expiredGrants(expired)
                .effectivePermissions(effective)
                .asOf(now)
                .build();
    }

    /**
     * Consent check for one pair. Only the provider, the patient or a privileged role may ask,
     * since the answer and the matched token id reveal the relationship.
     */
    public AccessDecision evaluate(String requesterId, UserRole role, String providerId, String patientId,
                                   ResourceType resourceType, AccessLevel accessLevel) {
        if (!providerId.equals(requesterId) && !patientId.equals(requesterId) && !isPrivileged(role)) {
            log.warn("User {} attempted to evaluate consent between {} and {}", requesterId, patientId, providerId);
            throw new ForbiddenException("Not a party to this consent relationship");
        }
        return accessEvaluator.evaluate(providerId, patientId, resourceType, accessLevel, clock.instant());
    }

    public AccessDecision validateToken(String requesterId, UserRole role, String tokenId, String providerId,
                                        ResourceType resourceType, AccessLevel accessLevel) {
        boolean allowed = providerId.equals(requesterId) || isPrivileged(role)
                || consentStore.find(tokenId).map(token -> token.getPatientId().equals(requesterId)).orElse(false);
        if (!allowed) {
            log.warn("User {} attempted to validate consent token {} for provider {}", requesterId, tokenId, providerId);
            throw new ForbiddenException("Not a party to this consent token");
        }
        return accessEvaluator.evaluateToken(tokenId, providerId, resourceType, accessLevel, clock.instant());
    }

    private boolean isParty(ConsentToken token, String requesterId) {
        return token.getPatientId().equals(requesterId) || token.getProviderId().equals(requesterId);
    }

    private boolean isPrivileged(UserRole role) {
        return role == UserRole.ADMIN || role == UserRole.AUDITOR;
    }
}
