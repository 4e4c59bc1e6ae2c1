package com.medledger.consentservice.dto.consent;

import com.medledger.consentservice.models.AccessLevel;
import com.medledger.consentservice.models.ConsentPermission;
import com.medledger.consentservice.models.ResourceType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PermissionRequest {

    @NotNull(message = "resourceType is required")
    private ResourceType resourceType;

    @NotNull(message = "accessLevel is required")
    private AccessLevel accessLevel;

    public ConsentPermission toPermission() {
        return new ConsentPermission(resourceType, accessLevel);
    }
}
