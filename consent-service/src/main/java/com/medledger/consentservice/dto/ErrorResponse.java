package com.medledger.consentservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@Builder
public class ErrorResponse {

    private boolean success;
    private String code;
    private String message;
    private boolean retryable;
    private Long retryAfter;
    private Instant timestamp;
}
