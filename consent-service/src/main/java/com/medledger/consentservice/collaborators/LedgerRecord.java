package com.medledger.consentservice.collaborators;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class LedgerRecord {
    String transactionId;
    String contractFunction;
    List<String> args;
    Instant committedAt;
}
