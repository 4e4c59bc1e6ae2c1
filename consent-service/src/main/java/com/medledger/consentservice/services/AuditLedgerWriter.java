package com.medledger.consentservice.services;

import com.medledger.consentservice.collaborators.KeyDirectory;
import com.medledger.consentservice.collaborators.LedgerClient;
import com.medledger.consentservice.collaborators.LedgerReceipt;
import com.medledger.consentservice.collaborators.LedgerRecord;
import com.medledger.consentservice.collaborators.SignatureProvider;
import com.medledger.consentservice.configurations.ConsentEngineProperties;
import com.medledger.consentservice.exceptions.AuditFailureException;
import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.exceptions.DependencyUnavailableException;
import com.medledger.consentservice.models.AuditEntry;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.details.AuditDetails;
import com.medledger.consentservice.repository.AuditEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends signed, hash-chained entries to the audit trail and verifies the chain.
 *
 * <p>Block numbers are assigned under a single fair lock that stays held until the
 * surrounding transaction completes. The next writer therefore always reads a committed head,
 * and an append that rolls back leaves no hole in the sequence. Callers that append inside
 * their own transaction get atomicity with their other writes; standalone appends run in a
 * transaction of their own and are retried when another instance claimed the same block.
 */
@Service
@Slf4j
public class AuditLedgerWriter {

    public static final String GENESIS_HASH = "0".repeat(64);
    public static final String LEDGER_FUNCTION = "AuditContract.logEvent";

    private static final int ANCHOR_HASH_ARG = 4;

    private final AuditEntryRepository auditEntries;
    private final AuditHashing hashing;
    private final SignatureProvider signatureProvider;
    private final KeyDirectory keyDirectory;
    private final LedgerClient ledgerClient;
    private final DependencyCalls dependencyCalls;
    private final ConsentEngineProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;
    private final ReentrantLock sequenceLock = new ReentrantLock(true);

    public AuditLedgerWriter(AuditEntryRepository auditEntries,
                             AuditHashing hashing,
                             SignatureProvider signatureProvider,
                             KeyDirectory keyDirectory,
                             LedgerClient ledgerClient,
                             DependencyCalls dependencyCalls,
                             ConsentEngineProperties properties,
                             Clock clock,
                             PlatformTransactionManager transactionManager) {
        this.auditEntries = auditEntries;
        this.hashing = hashing;
        this.signatureProvider = signatureProvider;
        this.keyDirectory = keyDirectory;
        this.ledgerClient = ledgerClient;
        this.dependencyCalls = dependencyCalls;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(Math.max(1, properties.getAudit().getMaxAppendAttempts()))
                .fixedBackoff(50)
                .retryOn(DataIntegrityViolationException.class)
                .build();
    }

    /**
     * Appends one entry. Joins the caller's transaction when there is one.
     *
     * @throws BadRequestException   when the details do not belong to the event type
     * @throws AuditFailureException when signing or ledger anchoring fails
     */
    public AuditEntry append(AuditEventType eventType, String userId, String resourceId,
                             AuditDetails details, String signerKeyRef) {
        if (eventType == null) {
            throw new BadRequestException("Audit event type is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new BadRequestException("Audit user id is required");
        }
        if (!eventType.accepts(details)) {
            throw new BadRequestException("Details of type "
                    + (details != null ? details.getClass().getSimpleName() : "null")
                    + " do not match event type " + eventType.getValue());
        }
        String keyRef = signerKeyRef != null && !signerKeyRef.isBlank() ? signerKeyRef : userId;
        String detailsJson = hashing.canonicalDetails(details);

        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return appendInTransaction(eventType, userId, resourceId, detailsJson, keyRef);
        }
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying audit append for {} after block collision (attempt {})",
                        eventType.getValue(), context.getRetryCount() + 1);
            }
            return transactionTemplate.execute(status ->
                    appendInTransaction(eventType, userId, resourceId, detailsJson, keyRef));
        });
    }

    private AuditEntry appendInTransaction(AuditEventType eventType, String userId, String resourceId,
                                           String detailsJson, String signerKeyRef) {
        holdSequenceLockUntilCompletion();

        AuditEntry head = auditEntries.findTopByOrderByBlockNumberDesc().orElse(null);
        long blockNumber = head == null ? 1L : head.getBlockNumber() + 1;
        String previousHash = head == null ? GENESIS_HASH : head.getEntryHash();
        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        String entryId = UUID.randomUUID().toString();

        String entryHash = hashing.entryHash(blockNumber, eventType, userId, resourceId,
                timestamp, detailsJson, previousHash);

        String signature;
        LedgerReceipt receipt;
        try {
            signature = dependencyCalls.call("signature-provider",
                    () -> signatureProvider.sign(signerKeyRef, entryHash.getBytes(StandardCharsets.UTF_8)));
            List<String> args = List.of(entryId, eventType.getValue(), userId,
                    resourceId != null ? resourceId : "", entryHash, String.valueOf(blockNumber));
            receipt = dependencyCalls.call("ledger", () -> ledgerClient.submit(LEDGER_FUNCTION, args));
        } catch (DependencyUnavailableException e) {
            log.error("Audit append for {} by {} failed at block {}: {}",
                    eventType.getValue(), userId, blockNumber, e.getMessage());
            throw new AuditFailureException("Audit entry could not be recorded: " + e.getMessage(), e);
        }

        AuditEntry entry = AuditEntry.builder()
                .entryId(entryId)
                .blockNumber(blockNumber)
                .eventType(eventType)
                .userId(userId)
                .resourceId(resourceId)
                .timestamp(timestamp)
                .detailsJson(detailsJson)
                .previousHash(previousHash)
                .entryHash(entryHash)
                .signature(signature)
                .signerKeyRef(signerKeyRef)
                .transactionId(receipt.getTransactionId())
                .build();

        AuditEntry saved = auditEntries.saveAndFlush(entry);
        log.info("Audit block {} appended: {} by {} (ledger tx {})",
                blockNumber, eventType.getValue(), userId, receipt.getTransactionId());
        return saved;
    }

    private void holdSequenceLockUntilCompletion() {
        sequenceLock.lock();
        try {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    sequenceLock.unlock();
                }
            });
        } catch (RuntimeException e) {
            sequenceLock.unlock();
            throw e;
        }
    }

    /**
     * Walks blocks {@code fromBlock..toBlock} (whole chain when both are null) in ascending
     * order and reports every entry whose hash, linkage, sequence, signature or ledger anchor
     * does not check out.
     *
     * @throws DependencyUnavailableException when the ledger or signer cannot be reached
     */
    public IntegrityReport verifyIntegrity(Long fromBlock, Long toBlock) {
        Instant verifiedAt = clock.instant();
        AuditEntry head = auditEntries.findTopByOrderByBlockNumberDesc().orElse(null);
        long from = fromBlock != null ? fromBlock : 1L;
        if (from < 1) {
            throw new BadRequestException("fromBlock must be at least 1");
        }
        if (toBlock != null && toBlock < from) {
            throw new BadRequestException("toBlock must not be before fromBlock");
        }
        if (head == null || head.getBlockNumber() < from) {
            return IntegrityReport.builder()
                    .verified(true)
                    .totalEntries(0)
                    .corruptedEntries(0)
                    .tamperedEntries(List.of())
                    .fromBlock(from)
                    .toBlock(toBlock)
                    .verifiedAt(verifiedAt)
                    .build();
        }
        long to = toBlock != null ? Math.min(toBlock, head.getBlockNumber()) : head.getBlockNumber();

        String previousHash;
        if (from == 1L) {
            previousHash = GENESIS_HASH;
        } else {
            previousHash = auditEntries.findByBlockNumber(from - 1).map(AuditEntry::getEntryHash).orElse(null);
        }

        int batchSize = Math.max(1, properties.getAudit().getVerifyBatchSize());
        List<TamperedEntry> tampered = new ArrayList<>();
        long total = 0;
        long expectedBlock = from;
        long cursor = from - 1;

        while (true) {
            List<AuditEntry> batch = auditEntries.findBlockRange(cursor, to, PageRequest.of(0, batchSize));
            if (batch.isEmpty()) {
                break;
            }
            for (AuditEntry entry : batch) {
                total++;
                TamperedEntry problem = inspect(entry, expectedBlock, previousHash);
                if (problem != null) {
                    tampered.add(problem);
                }
                previousHash = entry.getEntryHash();
                expectedBlock = entry.getBlockNumber() + 1;
                cursor = entry.getBlockNumber();
            }
            if (batch.size() < batchSize) {
                break;
            }
        }

        if (tampered.isEmpty()) {
            log.info("Audit chain verified: {} entries in blocks {}..{}", total, from, to);
        } else {
            log.error("Audit chain verification found {} corrupted entries in blocks {}..{}",
                    tampered.size(), from, to);
        }

        return IntegrityReport.builder()
                .verified(tampered.isEmpty())
                .totalEntries(total)
                .corruptedEntries(tampered.size())
                .tamperedEntries(tampered)
                .fromBlock(from)
                .toBlock(to)
                .verifiedAt(verifiedAt)
                .build();
    }

    private TamperedEntry inspect(AuditEntry entry, long expectedBlock, String previousHash) {
        List<IntegrityProblem> problems = new ArrayList<>();
        List<String> descriptions = new ArrayList<>();

        if (entry.getBlockNumber() != expectedBlock) {
            problems.add(IntegrityProblem.SEQUENCE_GAP);
            descriptions.add("expected block " + expectedBlock + " but found " + entry.getBlockNumber());
        }

        String recomputed = hashing.entryHash(entry.getBlockNumber(), entry.getEventType(), entry.getUserId(),
                entry.getResourceId(), entry.getTimestamp(), entry.getDetailsJson(), entry.getPreviousHash());
        if (!recomputed.equals(entry.getEntryHash())) {
            problems.add(IntegrityProblem.CONTENT_HASH_MISMATCH);
            descriptions.add("content hashes to " + recomputed + " but entry records " + entry.getEntryHash());
        }

        if (previousHash != null && !previousHash.equals(entry.getPreviousHash())) {
            problems.add(IntegrityProblem.CHAIN_BROKEN);
            descriptions.add("previousHash does not match the preceding entry");
        }

        if (!signatureValid(entry)) {
            problems.add(IntegrityProblem.SIGNATURE_INVALID);
            descriptions.add("signature does not verify for key reference " + entry.getSignerKeyRef());
        }

        if (properties.getAudit().isVerifyLedgerAnchors() && !anchored(entry)) {
            problems.add(IntegrityProblem.LEDGER_ANCHOR_MISSING);
            descriptions.add("no ledger transaction anchors hash " + entry.getEntryHash());
        }

        if (problems.isEmpty()) {
            return null;
        }
        log.warn("Audit block {} failed verification: {}", entry.getBlockNumber(), problems);
        return TamperedEntry.builder()
                .blockNumber(entry.getBlockNumber())
                .entryId(entry.getEntryId())
                .problems(problems)
                .descriptions(descriptions)
                .build();
    }

    private boolean signatureValid(AuditEntry entry) {
        return dependencyCalls.call("signature-provider", () -> {
            PublicKey publicKey = keyDirectory.publicKeyFor(entry.getSignerKeyRef());
            return signatureProvider.verify(publicKey,
                    entry.getEntryHash().getBytes(StandardCharsets.UTF_8), entry.getSignature());
        });
    }

    private boolean anchored(AuditEntry entry) {
        if (entry.getTransactionId() == null) {
            return false;
        }
        List<LedgerRecord> records = dependencyCalls.call("ledger",
                () -> ledgerClient.query(Map.of("transactionId", entry.getTransactionId())));
        return records.stream().anyMatch(record -> LEDGER_FUNCTION.equals(record.getContractFunction())
                && record.getArgs().size() > ANCHOR_HASH_ARG
                && entry.getEntryHash().equals(record.getArgs().get(ANCHOR_HASH_ARG)));
    }
}
