package com.medledger.consentservice.services;

import com.medledger.consentservice.models.ConsentToken;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Unrevoked tokens of one (patient, provider) pair as of {@code asOf}, split into the ones
 * still live and the ones that have lazily expired. Both lists are ordered by creation time.
 */
@Value
@Builder
public class ConsentSnapshot {
    String patientId;
    String providerId;
    Instant asOf;
    List<ConsentToken> live;
    List<ConsentToken> expired;
}
