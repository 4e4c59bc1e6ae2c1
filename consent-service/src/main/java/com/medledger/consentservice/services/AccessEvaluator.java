package com.medledger.consentservice.services;

import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.models.AccessDecision;
import com.medledger.consentservice.models.AccessLevel;
import com.medledger.consentservice.models.ConsentToken;
import com.medledger.consentservice.models.DecisionReason;
import com.medledger.consentservice.models.ResourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a provider may perform an access on a patient's data. Decisions have no
 * side effects; auditing them is the caller's job.
 *
 * <p>Access levels are not hierarchical: write never implies read, and read never implies write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessEvaluator {

    private static final Comparator<ConsentToken> LATEST_FIRST =
            Comparator.comparing(ConsentToken::getCreatedAt).reversed();

    private final ConsentStore consentStore;

    public AccessDecision evaluate(String providerId, String patientId, ResourceType resourceType,
                                   AccessLevel accessLevel, Instant now) {
        requireRequest(resourceType, accessLevel, now);
        ConsentSnapshot snapshot = consentStore.snapshot(patientId, providerId, now);
        AccessDecision decision = decide(snapshot, resourceType, accessLevel);
        log.debug("Access {} for provider {} on patient {} {}:{} -> {}", decision.isGranted() ? "granted" : "denied",
                providerId, patientId, resourceType.getValue(), accessLevel.getValue(), decision.getReason());
        return decision;
    }

    /**
     * Pure decision over a snapshot. The most recently created live token with an exact
     * permission match wins; otherwise the reason explains the closest miss.
     */
    public AccessDecision decide(ConsentSnapshot snapshot, ResourceType resourceType, AccessLevel accessLevel) {
        List<ConsentToken> live = new ArrayList<>(snapshot.getLive());
        live.sort(LATEST_FIRST);
        for (ConsentToken token : live) {
            if (token.grants(resourceType, accessLevel)) {
                return AccessDecision.granted(token.getTokenId());
            }
        }

        if (snapshot.getExpired().stream().anyMatch(token -> token.grants(resourceType, accessLevel))) {
            return AccessDecision.denied(DecisionReason.EXPIRED);
        }
        if (live.stream().anyMatch(token -> token.coversResourceType(resourceType))) {
            return AccessDecision.denied(DecisionReason.WRONG_ACCESS_LEVEL);
        }
        if (!live.isEmpty()) {
            return AccessDecision.denied(DecisionReason.WRONG_RESOURCE_TYPE);
        }
        return AccessDecision.denied(DecisionReason.NO_CONSENT);
    }

    /**
     * Checks one specific token, the only path that reports {@link DecisionReason#REVOKED}.
     */
    public AccessDecision evaluateToken(String tokenId, String providerId, ResourceType resourceType,
                                        AccessLevel accessLevel, Instant now) {
        requireRequest(resourceType, accessLevel, now);
        Optional<ConsentToken> token = consentStore.find(tokenId);
        if (token.isEmpty() || !token.get().getProviderId().equals(providerId)) {
            return AccessDecision.denied(DecisionReason.NO_CONSENT);
        }
        return decideToken(token.get(), resourceType, accessLevel, now);
    }

    public AccessDecision decideToken(ConsentToken token, ResourceType resourceType,
                                      AccessLevel accessLevel, Instant now) {
        if (!token.isActive()) {
            return AccessDecision.denied(DecisionReason.REVOKED);
        }
        if (token.isExpiredAt(now)) {
            return AccessDecision.denied(DecisionReason.EXPIRED);
        }
        if (token.grants(resourceType, accessLevel)) {
            return AccessDecision.granted(token.getTokenId());
        }
        if (token.coversResourceType(resourceType)) {
            return AccessDecision.denied(DecisionReason.WRONG_ACCESS_LEVEL);
        }
        return AccessDecision.denied(DecisionReason.WRONG_RESOURCE_TYPE);
    }

    private void requireRequest(ResourceType resourceType, AccessLevel accessLevel, Instant now) {
        if (resourceType == null || accessLevel == null) {
            throw new BadRequestException("resourceType and accessLevel are required");
        }
        if (now == null) {
            throw new BadRequestException("Evaluation time is required");
        }
    }
}
