package com.medledger.consentservice.dto.consent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medledger.consentservice.models.AccessDecision;
import com.medledger.consentservice.models.DecisionReason;
import lombok.Builder;
import lombok.Data;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@Builder
public class AccessDecisionResponse {

    private boolean granted;
    private DecisionReason reason;
    private String matchedTokenId;

    public static AccessDecisionResponse from(AccessDecision decision) {
        return AccessDecisionResponse.builder()
                .granted(decision.isGranted())
                .reason(decision.getReason())
                .matchedTokenId(decision.getMatchedTokenId())
                .build();
    }
}
