package com.medledger.consentservice.dto.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@Builder
public class RecordAccessResponse {

    private boolean success;
    private String recordId;
    private String matchedTokenId;
    private RecordMetadataResponse metadata;
    /** Base64 ciphertext; decryption happens on the client. */
    private String ciphertext;
    private String auditEntryId;
}
