package com.medledger.consentservice.collaborators;

import java.util.List;
import java.util.Map;

/**
 * Submit/query boundary of the permissioned ledger. Implementations are expected to be
 * durable and transactional; this service never re-implements consensus.
 */
public interface LedgerClient {

    LedgerReceipt submit(String contractFunction, List<String> args);

    /**
     * @param selector field/value pairs every returned record must match
     */
    List<LedgerRecord> query(Map<String, String> selector);
}
