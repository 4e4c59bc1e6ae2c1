package com.medledger.consentservice.dto.audit;

import com.medledger.consentservice.models.AuditEventType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AccountEventRequest {

    @NotNull(message = "eventType is required")
    private AuditEventType eventType;

    @NotBlank(message = "userId is required")
    @Size(max = 100)
    private String userId;

    @Size(max = 100)
    private String resourceId;

    private String role;

    private String outcome;

    @Size(max = 500)
    private String message;
}
