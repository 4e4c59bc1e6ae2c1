package com.medledger.consentservice.dto.record;

import com.medledger.consentservice.models.ResourceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateRecordRequest {

    @NotBlank(message = "patientId is required")
    private String patientId;

    @NotNull(message = "resourceType is required")
    private ResourceType resourceType;

    @Size(max = 200)
    private String title;

    @Size(max = 1000)
    private String description;

    @Size(max = 100)
    private String mimeType;

    @Size(max = 128)
    private String encryptionKeyHash;

    /** Base64 of the client-side encrypted payload. */
    @NotBlank(message = "ciphertext is required")
    private String ciphertext;
}
