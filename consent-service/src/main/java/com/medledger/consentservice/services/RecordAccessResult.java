package com.medledger.consentservice.services;

import com.medledger.consentservice.models.DecisionReason;
import com.medledger.consentservice.models.MedicalRecord;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecordAccessResult {

    public enum Outcome {
        GRANTED(false),
        DENIED(false),
        NOT_FOUND(false),
        STORAGE_UNAVAILABLE(true),
        UNAVAILABLE(true);

        private final boolean retryable;

        Outcome(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    Outcome outcome;
    String recordId;
    DecisionReason reason;
    String matchedTokenId;
    MedicalRecord record;
    byte[] ciphertext;
    String auditEntryId;
    String failure;
}
