package com.medledger.consentservice.controllers;

import com.medledger.consentservice.dto.audit.AccountEventRequest;
import com.medledger.consentservice.dto.audit.AuditEntryResponse;
import com.medledger.consentservice.dto.audit.AuditPageResponse;
import com.medledger.consentservice.exceptions.ForbiddenException;
import com.medledger.consentservice.models.AuditEntry;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.UserRole;
import com.medledger.consentservice.models.details.AccountEventDetails;
import com.medledger.consentservice.services.AuditHashing;
import com.medledger.consentservice.services.AuditPage;
import com.medledger.consentservice.services.AuditQuery;
import com.medledger.consentservice.services.AuditTrailService;
import com.medledger.consentservice.services.IntegrityReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditTrailService auditTrailService;
    private final AuditHashing auditHashing;

    /**
     * Page through the audit trail, newest first.
     *
     * @param pageToken opaque cursor from the previous page's {@code nextPageToken}
     */
    @GetMapping
    public ResponseEntity<AuditPageResponse> query(
            @RequestHeader("X-User-Id") String requesterId,
            @RequestHeader(value = "X-User-Role", required = false) String role,
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) List<AuditEventType> eventTypes,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) Integer pageSize,
            @RequestParam(required = false) String pageToken) {
        AuditQuery query = AuditQuery.builder()
                .userId(userId)
                .eventTypes(eventTypes != null ? new LinkedHashSet<>(eventTypes) : null)
                .from(from)
                .to(to)
                .pageSize(pageSize)
                .pageToken(pageToken)
                .build();
        AuditPage page = auditTrailService.queryFor(requesterId, UserRole.fromHeader(role), query);
        return ResponseEntity.ok(AuditPageResponse.builder()
                .entries(page.getEntries().stream().map(this::toResponse).collect(Collectors.toList()))
                .totalCount(page.getTotalCount())
                .nextPageToken(page.getNextPageToken())
                .build());
    }

    /**
     * Intake for account events (registration, approval, login). The caller must be the subject
     * of the event, an internal service or an administrator.
     */
    @PostMapping("/events")
    public ResponseEntity<AuditEntryResponse> logEvent(@RequestHeader("X-User-Id") String requesterId,
                                                       @RequestHeader(value = "X-User-Role", required = false) String role,
                                                       @Valid @RequestBody AccountEventRequest request) {
        AccountEventDetails details = AccountEventDetails.builder()
                .role(request.getRole())
                .outcome(request.getOutcome())
                .message(request.getMessage())
                .build();
        AuditEntry entry = auditTrailService.recordAccountEvent(requesterId, UserRole.fromHeader(role),
                request.getEventType(), request.getUserId(),
                request.getResourceId(), details);
        return ResponseEntity.status(HttpStatus.CREATED).body(AuditEntryResponse.from(entry, details));
    }

    @GetMapping("/verify")
    public ResponseEntity<IntegrityReport> verify(@RequestHeader(value = "X-User-Role", required = false) String role,
                                                  @RequestParam(required = false) Long fromBlock,
                                                  @RequestParam(required = false) Long toBlock) {
        UserRole userRole = UserRole.fromHeader(role);
        if (userRole == null || !userRole.canReadAuditTrail()) {
            throw new ForbiddenException("Auditor or administrator role required");
        }
        return ResponseEntity.ok(auditTrailService.verifyIntegrity(fromBlock, toBlock));
    }

    private AuditEntryResponse toResponse(AuditEntry entry) {
        return AuditEntryResponse.from(entry, auditHashing.readDetails(entry.getDetailsJson()));
    }
}
