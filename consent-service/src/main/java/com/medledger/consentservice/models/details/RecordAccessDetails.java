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
public class RecordAccessDetails extends AuditDetails {

    public static final String OUTCOME_GRANTED = "granted";
    public static final String OUTCOME_DENIED = "denied";
    public static final String OUTCOME_NOT_FOUND = "not_found";
    public static final String OUTCOME_STORAGE_UNAVAILABLE = "storage_unavailable";
    public static final String OUTCOME_UNAVAILABLE = "unavailable";

    private String outcome;
    private String reason;
    private String matchedTokenId;
    private String patientId;
    private String resourceType;
}
