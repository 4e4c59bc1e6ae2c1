package com.medledger.consentservice.dto.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@Builder
public class AuditPageResponse {

    private List<AuditEntryResponse> entries;
    private long totalCount;
    private String nextPageToken;
}
