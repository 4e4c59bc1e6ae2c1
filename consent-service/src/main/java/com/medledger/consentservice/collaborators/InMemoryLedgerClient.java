package com.medledger.consentservice.collaborators;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stand-in ledger for local runs and tests. Every submission is committed immediately and
 * can be queried back by {@code transactionId}, {@code contractFunction} or positional
 * argument ({@code arg0}, {@code arg1}, ...).
 */
@Slf4j
public class InMemoryLedgerClient implements LedgerClient {

    private final Map<String, LedgerRecord> transactions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLedgerClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public LedgerReceipt submit(String contractFunction, List<String> args) {
        String transactionId = "tx-" + UUID.randomUUID();
        LedgerRecord record = LedgerRecord.builder()
                .transactionId(transactionId)
                .contractFunction(contractFunction)
                .args(List.copyOf(args))
                .committedAt(clock.instant())
                .build();
        transactions.put(transactionId, record);
        log.debug("Committed ledger transaction {} for {}", transactionId, contractFunction);
        return LedgerReceipt.builder()
                .transactionId(transactionId)
                .committedAt(record.getCommittedAt())
                .build();
    }

    @Override
    public List<LedgerRecord> query(Map<String, String> selector) {
        String transactionId = selector.get("transactionId");
        if (transactionId != null) {
            LedgerRecord record = transactions.get(transactionId);
            return record != null && matches(record, selector) ? List.of(record) : List.of();
        }
        List<LedgerRecord> results = new ArrayList<>();
        for (LedgerRecord record : transactions.values()) {
            if (matches(record, selector)) {
                results.add(record);
            }
        }
        return results;
    }

    private boolean matches(LedgerRecord record, Map<String, String> selector) {
        for (Map.Entry<String, String> criterion : selector.entrySet()) {
            String key = criterion.getKey();
            String expected = criterion.getValue();
            if (key.equals("transactionId")) {
                if (!record.getTransactionId().equals(expected)) {
                    return false;
                }
            } else if (key.equals("contractFunction")) {
                if (!record.getContractFunction().equals(expected)) {
                    return false;
                }
            } else if (key.startsWith("arg")) {
                int index = Integer.parseInt(key.substring(3));
                if (index >= record.getArgs().size() || !record.getArgs().get(index).equals(expected)) {
                    return false;
                }
            } else {
                return false;
            }
        }
        return true;
    }
}
