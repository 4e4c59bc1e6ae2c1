package com.medledger.consentservice.dto.consent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.medledger.consentservice.models.ConsentPermission;
import com.medledger.consentservice.models.ConsentToken;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@Builder
public class ConsentTokenResponse {

    private String tokenId;
    private String patientId;
    private String providerId;
    private List<ConsentPermission> permissions;
    private Instant expirationTime;
    /** active, expired or revoked as of the response time. */
    private String status;
    private Instant createdAt;
    private Instant revokedAt;
    private String revokedBy;

    public static ConsentTokenResponse from(ConsentToken token, Instant now) {
        String status = !token.isActive() ? "revoked" : token.isExpiredAt(now) ? "expired" : "active";
        return ConsentTokenResponse.builder()
                .tokenId(token.getTokenId())
                .patientId(token.getPatientId())
                .providerId(token.getProviderId())
                .permissions(List.copyOf(token.getPermissions()))
                .expirationTime(token.getExpirationTime())
                .status(status)
                .createdAt(token.getCreatedAt())
                .revokedAt(token.getRevokedAt())
                .revokedBy(token.getRevokedBy())
                .build();
    }
}
