package com.medledger.consentservice.services;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TamperedEntry {
    long blockNumber;
    String entryId;
    List<IntegrityProblem> problems;
    List<String> descriptions;
}
