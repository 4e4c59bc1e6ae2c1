package com.medledger.consentservice.models.details;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RecordCreatedDetails extends AuditDetails {

    private String outcome;
    private String reason;
    private String patientId;
    private String resourceType;
    private String contentHash;
    private String matchedTokenId;
}
