package com.medledger.consentservice.dto.consent;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RevokeConsentRequest {

    @NotBlank(message = "requesterSignature is required")
    @Size(max = 1024)
    private String requesterSignature;
}
