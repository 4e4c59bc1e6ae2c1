package com.medledger.consentservice.services;

import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.models.AuditEntry;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.details.AccountEventDetails;
import com.medledger.consentservice.repository.AuditEntryRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Each test starts from an empty chain.
 */
@SpringBootTest
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_EACH_TEST_METHOD)
class AuditLedgerWriterIntegrationTest {

    @Autowired
    private AuditLedgerWriter auditWriter;

    @Autowired
    private AuditEntryRepository auditEntries;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private AuditEntry login(String userId) {
        return auditWriter.append(AuditEventType.LOGIN_ATTEMPT, userId, null,
                AccountEventDetails.builder().outcome("success").role("patient").build(), null);
    }

    @Test
    @DisplayName("entries form a chain starting at the genesis hash")
    void chainsEntriesFromGenesis() {
        AuditEntry first = login("alice");
        AuditEntry second = login("bob");
        AuditEntry third = login("carol");

        assertEquals(1L, first.getBlockNumber());
        assertEquals(AuditLedgerWriter.GENESIS_HASH, first.getPreviousHash());
        assertEquals(2L, second.getBlockNumber());
        assertEquals(first.getEntryHash(), second.getPreviousHash());
        assertEquals(3L, third.getBlockNumber());
        assertEquals(second.getEntryHash(), third.getPreviousHash());

        assertEquals("alice", first.getSignerKeyRef());
        assertNotNull(first.getSignature());
        assertNotNull(first.getTransactionId());
    }

    @Test
    void untouchedChainVerifies() {
        for (int i = 0; i < 5; i++) {
            login("user-" + i);
        }

        IntegrityReport report = auditWriter.verifyIntegrity(null, null);

        assertTrue(report.isVerified());
        assertEquals(5, report.getTotalEntries());
        assertEquals(0, report.getCorruptedEntries());
        assertTrue(report.getTamperedEntries().isEmpty());
    }

    @Test
    void emptyChainVerifies() {
        IntegrityReport report = auditWriter.verifyIntegrity(null, null);

        assertTrue(report.isVerified());
        assertEquals(0, report.getTotalEntries());
    }

    @Test
    void verifiesOnlyTheRequestedRange() {
        for (int i = 0; i < 6; i++) {
            login("user-" + i);
        }

        IntegrityReport report = auditWriter.verifyIntegrity(2L, 4L);

        assertTrue(report.isVerified());
        assertEquals(3, report.getTotalEntries());
        assertEquals(2L, report.getFromBlock());
        assertEquals(4L, report.getToBlock());
    }

    @Test
    void rejectsInvertedRange() {
        assertThrows(BadRequestException.class, () -> auditWriter.verifyIntegrity(5L, 2L));
        assertThrows(BadRequestException.class, () -> auditWriter.verifyIntegrity(0L, null));
    }

    @Test
    @DisplayName("rewriting stored details is reported as a content hash mismatch on that entry only")
    void detectsRewrittenDetails() {
        login("alice");
        AuditEntry target = login("bob");
        login("carol");

        jdbcTemplate.update("UPDATE audit_entries SET details = ? WHERE block_number = ?",
                "{\"message\":\"nothing happened\",\"outcome\":\"failure\",\"role\":\"patient\"}",
                target.getBlockNumber());

        IntegrityReport report = auditWriter.verifyIntegrity(null, null);

        assertFalse(report.isVerified());
        assertEquals(3, report.getTotalEntries());
        assertEquals(1, report.getCorruptedEntries());
        TamperedEntry tampered = report.getTamperedEntries().get(0);
        assertEquals(2L, tampered.getBlockNumber());
        assertTrue(tampered.getProblems().contains(IntegrityProblem.CONTENT_HASH_MISMATCH));
    }

    @Test
    @DisplayName("deleting an entry is reported as a gap and a broken link on the next one")
    void detectsDeletedEntry() {
        login("alice");
        AuditEntry removed = login("bob");
        login("carol");

        jdbcTemplate.update("DELETE FROM audit_entries WHERE entry_id = ?", removed.getEntryId());

        IntegrityReport report = auditWriter.verifyIntegrity(null, null);

        assertFalse(report.isVerified());
        assertEquals(2, report.getTotalEntries());
        assertEquals(1, report.getCorruptedEntries());
        TamperedEntry tampered = report.getTamperedEntries().get(0);
        assertEquals(3L, tampered.getBlockNumber());
        assertTrue(tampered.getProblems().contains(IntegrityProblem.SEQUENCE_GAP));
        assertTrue(tampered.getProblems().contains(IntegrityProblem.CHAIN_BROKEN));
    }

    @Test
    void rejectsDetailsOfAnotherEventType() {
        assertThrows(BadRequestException.class, () -> auditWriter.append(AuditEventType.CONSENT_GRANTED,
                "alice", "token-1", AccountEventDetails.builder().outcome("success").build(), null));
        assertEquals(0, auditEntries.count());
    }

    @Test
    void rejectsMissingUser() {
        assertThrows(BadRequestException.class, () -> auditWriter.append(AuditEventType.LOGIN_ATTEMPT,
                " ", null, AccountEventDetails.builder().build(), null));
    }

    @Test
    @DisplayName("concurrent appends produce a gap-free, verifiable chain")
    void concurrentAppendsStayContiguous() throws Exception {
        int threads = 8;
        int perThread = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String userId = "user-" + t;
                tasks.add(() -> {
                    for (int i = 0; i < perThread; i++) {
                        login(userId);
                    }
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(tasks, 60, TimeUnit.SECONDS)) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        List<AuditEntry> entries = auditEntries.findAll();
        assertEquals(threads * perThread, entries.size());
        List<Long> blocks = entries.stream().map(AuditEntry::getBlockNumber).sorted().toList();
        for (int i = 0; i < blocks.size(); i++) {
            assertEquals(i + 1L, blocks.get(i));
        }

        IntegrityReport report = auditWriter.verifyIntegrity(null, null);
        assertTrue(report.isVerified());
        assertEquals(threads * perThread, report.getTotalEntries());
    }
}
