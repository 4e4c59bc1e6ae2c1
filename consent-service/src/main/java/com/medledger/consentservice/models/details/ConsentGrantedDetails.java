package com.medledger.consentservice.models.details;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ConsentGrantedDetails extends AuditDetails {

    private String tokenId;
    private String patientId;
    private String providerId;
    private List<String> permissions;
    private String expirationTime;
}
