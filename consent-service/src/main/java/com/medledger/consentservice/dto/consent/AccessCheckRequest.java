package com.medledger.consentservice.dto.consent;

import com.medledger.consentservice.models.AccessLevel;
import com.medledger.consentservice.models.ResourceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Body of the evaluate and validate-token endpoints. {@code tokenId} is only read by the latter.
 */
@Data
public class AccessCheckRequest {

    private String tokenId;

    @NotBlank(message = "providerId is required")
    private String providerId;

    private String patientId;

    @NotNull(message = "resourceType is required")
    private ResourceType resourceType;

    @NotNull(message = "accessLevel is required")
    private AccessLevel accessLevel;
}
