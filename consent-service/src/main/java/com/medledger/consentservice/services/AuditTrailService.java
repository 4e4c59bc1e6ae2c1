package com.medledger.consentservice.services;

import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.exceptions.ForbiddenException;
import com.medledger.consentservice.models.AuditEntry;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.UserRole;
import com.medledger.consentservice.models.details.AccountEventDetails;
import com.medledger.consentservice.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/**
 * Read side of the audit trail plus the intake for account events reported by other services.
 *
 * <p>Queries page through entries newest block first. Page tokens are keyset cursors on the
 * block number, so entries appended while a client is paging never shift or repeat earlier
 * pages.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrailService {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 1000;

    private static final String CURSOR_PREFIX = "after:";

    private final AuditEntryRepository auditEntries;
    private final AuditLedgerWriter auditWriter;

    /**
     * Auditors and administrators see every entry; anyone else only their own.
     */
    public AuditPage queryFor(String requesterId, UserRole role, AuditQuery query) {
        if (role != null && role.canReadAuditTrail()) {
            return query(query);
        }
        if (query.getUserId() != null && !query.getUserId().equals(requesterId)) {
            throw new ForbiddenException("Only auditors may read another user's audit trail");
        }
        return query(AuditQuery.builder()
                .userId(requesterId)
                .eventTypes(query.getEventTypes())
                .from(query.getFrom())
                .to(query.getTo())
                .pageSize(query.getPageSize())
                .pageToken(query.getPageToken())
                .build());
    }

    public AuditPage query(AuditQuery query) {
        int pageSize = query.getPageSize() != null ? query.getPageSize() : DEFAULT_PAGE_SIZE;
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new BadRequestException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (query.getFrom() != null && query.getTo() != null && !query.getFrom().isBefore(query.getTo())) {
            throw new BadRequestException("from must be before to");
        }

        Specification<AuditEntry> filters = filters(query);
        long totalCount = auditEntries.count(filters);

        Specification<AuditEntry> page = filters;
        if (query.getPageToken() != null && !query.getPageToken().isBlank()) {
            long cursor = decodeCursor(query.getPageToken());
            page = page.and((root, criteria, builder) -> builder.lessThan(root.<Long>get("blockNumber"), cursor));
        }

        Page<AuditEntry> result = auditEntries.findAll(page,
                PageRequest.of(0, pageSize, Sort.by(Sort.Direction.DESC, "blockNumber")));

        String nextPageToken = null;
        if (result.hasNext() && !result.getContent().isEmpty()) {
            AuditEntry last = result.getContent().get(result.getContent().size() - 1);
            nextPageToken = encodeCursor(last.getBlockNumber());
        }
        return AuditPage.builder()
                .entries(result.getContent())
                .totalCount(totalCount)
                .nextPageToken(nextPageToken)
                .build();
    }

    /**
     * Records an account event reported by the authentication or user services. The entry is
     * signed with the subject's key, so only the subject itself, an internal service or an
     * administrator may report it.
     */
    public AuditEntry recordAccountEvent(String requesterId, UserRole role, AuditEventType eventType, String userId,
                                         String resourceId, AccountEventDetails details) {
        if (eventType == null || !eventType.isExternallyReported()) {
            throw new BadRequestException("Event type " + (eventType != null ? eventType.getValue() : null)
                    + " can only be recorded by the consent engine");
        }
        boolean self = requesterId != null && requesterId.equals(userId);
        if (!self && role != UserRole.ADMIN && role != UserRole.SERVICE) {
            log.warn("User {} attempted to record {} on behalf of {}", requesterId, eventType.getValue(), userId);
            throw new ForbiddenException("Account events can only be reported by the user, a service or an administrator");
        }
        AuditEntry entry = auditWriter.append(eventType, userId, resourceId, details, userId);
        log.info("Recorded {} for user {} reported by {}", eventType.getValue(), userId, requesterId);
        return entry;
    }

    public IntegrityReport verifyIntegrity(Long fromBlock, Long toBlock) {
        return auditWriter.verifyIntegrity(fromBlock, toBlock);
    }

    private Specification<AuditEntry> filters(AuditQuery query) {
        Specification<AuditEntry> spec = Specification.where(null);
        if (query.getUserId() != null && !query.getUserId().isBlank()) {
            String userId = query.getUserId();
            spec = spec.and((root, criteria, builder) -> builder.equal(root.get("userId"), userId));
        }
        if (query.getEventTypes() != null && !query.getEventTypes().isEmpty()) {
            spec = spec.and((root, criteria, builder) -> root.get("eventType").in(query.getEventTypes()));
        }
        if (query.getFrom() != null) {
            spec = spec.and((root, criteria, builder) ->
                    builder.greaterThanOrEqualTo(root.<Instant>get("timestamp"), query.getFrom()));
        }
        if (query.getTo() != null) {
            spec = spec.and((root, criteria, builder) ->
                    builder.lessThan(root.<Instant>get("timestamp"), query.getTo()));
        }
        return spec;
    }

    static String encodeCursor(long blockNumber) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString((CURSOR_PREFIX + blockNumber).getBytes(StandardCharsets.UTF_8));
    }

    static long decodeCursor(String pageToken) {
        try {
            String decoded = new String(Base64.getUrlDecoder().decode(pageToken), StandardCharsets.UTF_8);
            if (!decoded.startsWith(CURSOR_PREFIX)) {
                throw new BadRequestException("Malformed page token");
            }
            return Long.parseLong(decoded.substring(CURSOR_PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Malformed page token");
        }
    }
}
