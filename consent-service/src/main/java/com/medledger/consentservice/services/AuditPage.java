package com.medledger.consentservice.services;

import com.medledger.consentservice.models.AuditEntry;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AuditPage {
    List<AuditEntry> entries;
    long totalCount;
    /** Absent on the last page. */
    String nextPageToken;
}
