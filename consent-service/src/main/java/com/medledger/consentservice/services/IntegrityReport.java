package com.medledger.consentservice.services;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a hash chain walk. Tampering is reported here, never thrown.
 */
@Value
@Builder
public class IntegrityReport {
    boolean verified;
    long totalEntries;
    long corruptedEntries;
    List<TamperedEntry> tamperedEntries;
    Long fromBlock;
    Long toBlock;
    Instant verifiedAt;
}
