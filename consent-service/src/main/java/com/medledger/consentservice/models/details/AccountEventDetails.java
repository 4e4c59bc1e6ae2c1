package com.medledger.consentservice.models.details;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Details for account lifecycle events reported by the auth and user services.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AccountEventDetails extends AuditDetails {

    private String role;
    private String outcome;
    private String message;
}
