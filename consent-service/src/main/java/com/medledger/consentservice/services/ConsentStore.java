package com.medledger.consentservice.services;

import com.medledger.consentservice.collaborators.KeyDirectory;
import com.medledger.consentservice.collaborators.SignatureProvider;
import com.medledger.consentservice.configurations.ConsentEngineProperties;
import com.medledger.consentservice.exceptions.AlreadyRevokedException;
import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.exceptions.ConflictException;
import com.medledger.consentservice.exceptions.ForbiddenException;
import com.medledger.consentservice.exceptions.InvalidExpirationException;
import com.medledger.consentservice.exceptions.ResourceNotFoundException;
import com.medledger.consentservice.models.AuditEntry;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.ConsentPermission;
import com.medledger.consentservice.models.ConsentToken;
import com.medledger.consentservice.models.details.ConsentGrantedDetails;
import com.medledger.consentservice.models.details.ConsentRevokedDetails;
import com.medledger.consentservice.repository.ConsentTokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.security.PublicKey;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Durable home of consent tokens.
 *
 * <p>Grant and revoke write the token and its audit entry in one transaction while holding the
 * pair's write lock; the pair's cache entry is dropped before the lock is released. Callers
 * must not wrap these methods in a transaction of their own, otherwise the lock would be
 * released before the outer commit.
 */
@Service
@Slf4j
public class ConsentStore {

    private final ConsentTokenRepository consentTokens;
    private final AuditLedgerWriter auditWriter;
    private final AccessCache accessCache;
    private final ConsentKeyLocks keyLocks;
    private final SignatureProvider signatureProvider;
    private final KeyDirectory keyDirectory;
    private final DependencyCalls dependencyCalls;
    private final ConsentEngineProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public ConsentStore(ConsentTokenRepository consentTokens,
                        AuditLedgerWriter auditWriter,
                        AccessCache accessCache,
                        ConsentKeyLocks keyLocks,
                        SignatureProvider signatureProvider,
                        KeyDirectory keyDirectory,
                        DependencyCalls dependencyCalls,
                        ConsentEngineProperties properties,
                        Clock clock,
                        PlatformTransactionManager transactionManager) {
        this.consentTokens = consentTokens;
        this.auditWriter = auditWriter;
        this.accessCache = accessCache;
        this.keyLocks = keyLocks;
        this.signatureProvider = signatureProvider;
        this.keyDirectory = keyDirectory;
        this.dependencyCalls = dependencyCalls;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Records a new consent grant.
     *
     * @param expirationTime {@code null} for a grant that never expires
     * @throws BadRequestException        on missing ids or permissions
     * @throws InvalidExpirationException when the expiration is not in the future
     * @throws ForbiddenException         when the patient signature does not verify
     */
    public ConsentToken grant(String patientId, String providerId, List<ConsentPermission> permissions,
                              Instant expirationTime, String patientSignature) {
        Instant now = clock.instant();
        requireId(patientId, "patientId");
        requireId(providerId, "providerId");
        List<ConsentPermission> normalized = normalize(permissions);
        if (expirationTime != null && !expirationTime.isAfter(now)) {
            throw new InvalidExpirationException("Expiration time " + expirationTime + " is not after " + now);
        }
        if (patientSignature == null || patientSignature.isBlank()) {
            throw new BadRequestException("patientSignature is required");
        }
        // The patient signs the permissions as submitted, duplicates and order included.
        verifyPatientSignature(patientId, providerId, permissions, expirationTime, patientSignature);

        ConsentPairKey key = ConsentPairKey.of(patientId, providerId);
        ReentrantReadWriteLock lock = keyLocks.lockFor(key);
        AtomicReference<AuditEntry> audited = new AtomicReference<>();
        String tokenId = UUID.randomUUID().toString();

        lock.writeLock().lock();
        try {
            ConsentToken saved = transactionTemplate.execute(status -> {
                ConsentToken token = ConsentToken.builder()
                        .tokenId(tokenId)
                        .patientId(patientId)
                        .providerId(providerId)
                        .permissions(new ArrayList<>(normalized))
                        .expirationTime(expirationTime)
                        .active(true)
                        .createdAt(nextCreatedAt(patientId, providerId, now))
                        .patientSignature(patientSignature)
                        .build();
                ConsentToken persisted = consentTokens.saveAndFlush(token);

                ConsentGrantedDetails details = ConsentGrantedDetails.builder()
                        .tokenId(tokenId)
                        .patientId(patientId)
                        .providerId(providerId)
                        .permissions(normalized.stream().map(ConsentPermission::toString).collect(Collectors.toList()))
                        .expirationTime(expirationTime != null ? expirationTime.toString() : null)
                        .build();
                audited.set(auditWriter.append(AuditEventType.CONSENT_GRANTED, patientId, tokenId, details, patientId));
                return persisted;
            });
            log.info("Consent {} granted by patient {} to provider {} for {}",
                    tokenId, patientId, providerId, normalized);
            return saved;
        } catch (RuntimeException e) {
            reportIfAnchored(audited.get(), "grant of consent " + tokenId, e);
            throw e;
        } finally {
            accessCache.invalidatePair(key);
            lock.writeLock().unlock();
        }
    }

    /**
     * Revokes a token. Ownership must already have been checked by the caller.
     *
     * @throws ResourceNotFoundException when the token does not exist
     * @throws AlreadyRevokedException   when the token is already inactive; nothing is audited
     * @throws ConflictException         when a concurrent update won the race
     */
    public RevocationResult revoke(String tokenId, String revokedBy, String requesterSignature) {
        requireId(tokenId, "tokenId");
        requireId(revokedBy, "revokedBy");
        ConsentToken existing = get(tokenId);

        ConsentPairKey key = ConsentPairKey.of(existing.getPatientId(), existing.getProviderId());
        ReentrantReadWriteLock lock = keyLocks.lockFor(key);
        AtomicReference<AuditEntry> audited = new AtomicReference<>();

        lock.writeLock().lock();
        try {
            ConsentToken revoked = transactionTemplate.execute(status -> {
                ConsentToken token = consentTokens.findById(tokenId)
                        .orElseThrow(() -> new ResourceNotFoundException("Consent token not found: " + tokenId));
                if (!token.isActive()) {
                    throw new AlreadyRevokedException(tokenId);
                }
                Instant revokedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
                if (revokedAt.isBefore(token.getCreatedAt())) {
                    revokedAt = token.getCreatedAt();
                }
                token.setActive(false);
                token.setRevokedAt(revokedAt);
                token.setRevokedBy(revokedBy);
                token.setRevocationSignature(requesterSignature);
                ConsentToken persisted = consentTokens.saveAndFlush(token);

                ConsentRevokedDetails details = ConsentRevokedDetails.builder()
                        .tokenId(tokenId)
                        .patientId(token.getPatientId())
                        .providerId(token.getProviderId())
                        .revokedBy(revokedBy)
                        .requesterSignature(requesterSignature)
                        .build();
                audited.set(auditWriter.append(AuditEventType.CONSENT_REVOKED, revokedBy, tokenId, details, revokedBy));
                return persisted;
            });
            log.info("Consent {} revoked by {}", tokenId, revokedBy);
            AuditEntry entry = audited.get();
            return RevocationResult.builder()
                    .tokenId(tokenId)
                    .patientId(revoked.getPatientId())
                    .providerId(revoked.getProviderId())
                    .revokedBy(revokedBy)
                    .revokedAt(revoked.getRevokedAt())
                    .auditEntryId(entry.getEntryId())
                    .transactionId(entry.getTransactionId())
                    .build();
        } catch (OptimisticLockingFailureException e) {
            reportIfAnchored(audited.get(), "revocation of consent " + tokenId, e);
            throw new ConflictException("Consent " + tokenId + " was modified concurrently", e);
        } catch (RuntimeException e) {
            reportIfAnchored(audited.get(), "revocation of consent " + tokenId, e);
            throw e;
        } finally {
            accessCache.invalidatePair(key);
            lock.writeLock().unlock();
        }
    }

    public ConsentToken get(String tokenId) {
        return find(tokenId)
                .orElseThrow(() -> new ResourceNotFoundException("Consent token not found: " + tokenId));
    }

    public Optional<ConsentToken> find(String tokenId) {
        if (tokenId == null || tokenId.isBlank()) {
            return Optional.empty();
        }
        return consentTokens.findById(tokenId);
    }

    public List<ConsentToken> listByPatient(String patientId) {
        requireId(patientId, "patientId");
        return consentTokens.findByPatientIdOrderByCreatedAtAsc(patientId);
    }

    public List<ConsentToken> listByProvider(String providerId) {
        requireId(providerId, "providerId");
        return consentTokens.findByProviderIdOrderByCreatedAtAsc(providerId);
    }

    public List<ConsentToken> listByPair(String patientId, String providerId) {
        requireId(patientId, "patientId");
        requireId(providerId, "providerId");
        return consentTokens.findByPatientIdAndProviderIdOrderByCreatedAtAsc(patientId, providerId);
    }

    public List<ConsentToken> findActiveGrants(String patientId, String providerId) {
        return findActiveGrants(patientId, providerId, clock.instant());
    }

    /**
     * Active, unexpired tokens of the pair. Expiration is applied on every call.
     */
    public List<ConsentToken> findActiveGrants(String patientId, String providerId, Instant now) {
        return snapshot(patientId, providerId, now).getLive();
    }

    /**
     * Reads the pair under its read lock, through the cache.
     */
    public ConsentSnapshot snapshot(String patientId, String providerId, Instant now) {
        requireId(patientId, "patientId");
        requireId(providerId, "providerId");
        ConsentPairKey key = ConsentPairKey.of(patientId, providerId);
        ReentrantReadWriteLock lock = keyLocks.lockFor(key);

        List<ConsentToken> unrevoked;
        lock.readLock().lock();
        try {
            unrevoked = accessCache.unrevokedTokens(key, k -> consentTokens
                    .findByPatientIdAndProviderIdAndActiveTrueOrderByCreatedAtAsc(k.getPatientId(), k.getProviderId()));
        } finally {
            lock.readLock().unlock();
        }

        List<ConsentToken> live = new ArrayList<>();
        List<ConsentToken> expired = new ArrayList<>();
        for (ConsentToken token : unrevoked) {
            if (token.isExpiredAt(now)) {
                expired.add(token);
            } else {
                live.add(token);
            }
        }
        return ConsentSnapshot.builder()
                .patientId(patientId)
                .providerId(providerId)
                .asOf(now)
                .live(live)
                .expired(expired)
                .build();
    }

    private void verifyPatientSignature(String patientId, String providerId, List<ConsentPermission> permissions,
                                        Instant expirationTime, String patientSignature) {
        if (!properties.getSignatures().isVerifyGrants()) {
            log.debug("Grant signature verification disabled, accepting grant from {}", patientId);
            return;
        }
        byte[] payload = ConsentGrantPayload.bytes(patientId, providerId, permissions, expirationTime);
        boolean valid = dependencyCalls.call("signature-provider", () -> {
            PublicKey publicKey = keyDirectory.publicKeyFor(patientId);
            return signatureProvider.verify(publicKey, payload, patientSignature);
        });
        if (!valid) {
            log.warn("Rejected consent grant from {} to {}: signature does not verify", patientId, providerId);
            throw new ForbiddenException("Patient signature does not verify for the grant payload");
        }
    }

    // createdAt is strictly increasing per pair.
    private Instant nextCreatedAt(String patientId, String providerId, Instant now) {
        Instant candidate = now.truncatedTo(ChronoUnit.MICROS);
        Optional<Instant> latest = consentTokens.findLatestCreatedAt(patientId, providerId);
        if (latest.isPresent() && !candidate.isAfter(latest.get())) {
            candidate = latest.get().plus(1, ChronoUnit.MICROS);
        }
        return candidate;
    }

    private List<ConsentPermission> normalize(List<ConsentPermission> permissions) {
        if (permissions == null || permissions.isEmpty()) {
            throw new BadRequestException("At least one permission is required");
        }
        Set<ConsentPermission> unique = new LinkedHashSet<>();
        for (ConsentPermission permission : permissions) {
            if (permission == null || permission.getResourceType() == null || permission.getAccessLevel() == null) {
                throw new BadRequestException("Permissions need both a resource type and an access level");
            }
            unique.add(new ConsentPermission(permission.getResourceType(), permission.getAccessLevel()));
        }
        return new ArrayList<>(unique);
    }

    private void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException(field + " is required");
        }
    }

    private void reportIfAnchored(AuditEntry entry, String operation, RuntimeException cause) {
        if (entry != null) {
            log.error("Reconciliation required: {} failed after audit block {} was anchored as ledger tx {}: {}",
                    operation, entry.getBlockNumber(), entry.getTransactionId(), cause.getMessage());
        }
    }
}
