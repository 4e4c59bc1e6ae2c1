package com.medledger.consentservice.models;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a consent evaluation. Derived, never persisted.
 */
@Getter
@ToString
@AllArgsConstructor(access = lombok.AccessLevel.PRIVATE)
public class AccessDecision {

    private final boolean granted;
    private final DecisionReason reason;
    private final String matchedTokenId;

    public static AccessDecision granted(String matchedTokenId) {
        return new AccessDecision(true, DecisionReason.OK, matchedTokenId);
    }

    public static AccessDecision denied(DecisionReason reason) {
        return new AccessDecision(false, reason, null);
    }
}
