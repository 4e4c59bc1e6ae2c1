package com.medledger.consentservice.dto.consent;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class GrantConsentRequest {

    @NotBlank(message = "patientId is required")
    @Size(max = 100)
    private String patientId;

    @NotBlank(message = "providerId is required")
    @Size(max = 100)
    private String providerId;

    @NotEmpty(message = "At least one permission is required")
    private List<@Valid PermissionRequest> permissions;

    // Absent means the consent never expires.
    private Instant expirationTime;

    @NotBlank(message = "patientSignature is required")
    @Size(max = 1024)
    private String patientSignature;
}
