package com.medledger.consentservice.services;

public enum IntegrityProblem {
    /** Stored content no longer hashes to the stored entry hash. */
    CONTENT_HASH_MISMATCH,
    /** previousHash does not equal the entry hash of the preceding block. */
    CHAIN_BROKEN,
    /** Block number is not the successor of the preceding block. */
    SEQUENCE_GAP,
    SIGNATURE_INVALID,
    LEDGER_ANCHOR_MISSING
}
