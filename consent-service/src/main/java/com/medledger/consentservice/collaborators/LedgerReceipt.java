package com.medledger.consentservice.collaborators;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class LedgerReceipt {
    String transactionId;
    Instant committedAt;
}
