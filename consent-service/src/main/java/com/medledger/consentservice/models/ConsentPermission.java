package com.medledger.consentservice.models;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsentPermission {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ResourceType resourceType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AccessLevel accessLevel;

    public boolean matches(ResourceType resourceType, AccessLevel accessLevel) {
        return this.resourceType == resourceType && this.accessLevel == accessLevel;
    }

    @Override
    public String toString() {
        return resourceType.getValue() + ":" + accessLevel.getValue();
    }
}
