package com.medledger.consentservice.controllers;

import com.medledger.consentservice.annotations.RateLimited;
import com.medledger.consentservice.dto.consent.AccessCheckRequest;
import com.medledger.consentservice.dto.consent.AccessDecisionResponse;
import com.medledger.consentservice.dto.consent.ConsentTokenResponse;
import com.medledger.consentservice.dto.consent.GrantConsentRequest;
import com.medledger.consentservice.dto.consent.PermissionRequest;
import com.medledger.consentservice.dto.consent.RevokeConsentRequest;
import com.medledger.consentservice.exceptions.BadRequestException;
import com.medledger.consentservice.exceptions.ForbiddenException;
import com.medledger.consentservice.models.ConsentToken;
import com.medledger.consentservice.models.UserRole;
import com.medledger.consentservice.services.AccessCache;
import com.medledger.consentservice.services.ConsentService;
import com.medledger.consentservice.services.ConsentStatusSummary;
import com.medledger.consentservice.services.RevocationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/consent")
@RequiredArgsConstructor
public class ConsentController {

    private final ConsentService consentService;
    private final AccessCache accessCache;
    private final Clock clock;

    /**
     * Grant consent from the calling patient to a provider.
     *
     * @param userId  caller identity supplied by the gateway
     * @param request permissions, optional expiration and the patient's signature over the grant payload
     * @return the stored consent token
     */
    @PostMapping("/grant")
    @RateLimited(maxRequests = 20, windowSeconds = 60, message = "Too many consent grants. Please wait a minute.")
    public ResponseEntity<ConsentTokenResponse> grantConsent(@RequestHeader("X-User-Id") String userId,
                                                             @Valid @RequestBody GrantConsentRequest request) {
        ConsentToken token = consentService.grantConsent(userId,
                request.getPatientId(),
                request.getProviderId(),
                request.getPermissions().stream().map(PermissionRequest::toPermission).collect(Collectors.toList()),
                request.getExpirationTime(),
                request.getPatientSignature());
        return ResponseEntity.status(HttpStatus.CREATED).body(ConsentTokenResponse.from(token, clock.instant()));
    }

    /**
     * Revoke a consent token. Only its patient or an administrator may do so.
     */
    @PostMapping("/{tokenId}/revoke")
    @RateLimited(maxRequests = 20, windowSeconds = 60, message = "Too many revocations. Please wait a minute.")
    public ResponseEntity<RevocationResult> revokeConsent(@RequestHeader("X-User-Id") String userId,
                                                          @RequestHeader(value = "X-User-Role", required = false) String role,
                                                          @PathVariable String tokenId,
                                                          @Valid @RequestBody RevokeConsentRequest request) {
        RevocationResult result = consentService.revokeConsent(userId, UserRole.fromHeader(role), tokenId,
                request.getRequesterSignature());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{tokenId}")
    public ResponseEntity<ConsentTokenResponse> getConsent(@RequestHeader("X-User-Id") String userId,
                                                           @RequestHeader(value = "X-User-Role", required = false) String role,
                                                           @PathVariable String tokenId) {
        ConsentToken token = consentService.getConsent(userId, UserRole.fromHeader(role), tokenId);
        return ResponseEntity.ok(ConsentTokenResponse.from(token, clock.instant()));
    }

    @GetMapping("/patient/{patientId}")
    public ResponseEntity<List<ConsentTokenResponse>> listPatientConsents(
            @RequestHeader("X-User-Id") String userId,
            @RequestHeader(value = "X-User-Role", required = false) String role,
            @PathVariable String patientId) {
        return ResponseEntity.ok(toResponses(consentService.listForPatient(userId, UserRole.fromHeader(role), patientId)));
    }

    @GetMapping("/provider/{providerId}")
    public ResponseEntity<List<ConsentTokenResponse>> listProviderConsents(
            @RequestHeader("X-User-Id") String userId,
            @RequestHeader(value = "X-User-Role", required = false) String role,
            @PathVariable String providerId) {
        return ResponseEntity.ok(toResponses(consentService.listForProvider(userId, UserRole.fromHeader(role), providerId)));
    }

    /**
     * Summary of the consent relationship between one patient and one provider.
     */
    @GetMapping("/status")
    public ResponseEntity<ConsentStatusSummary> status(@RequestHeader("X-User-Id") String userId,
                                                       @RequestHeader(value = "X-User-Role", required = false) String role,
                                                       @RequestParam String patientId,
                                                       @RequestParam String providerId) {
        return ResponseEntity.ok(consentService.status(userId, UserRole.fromHeader(role), patientId, providerId));
    }

    /**
     * Check whether a provider currently holds consent for an access. Only the parties or an
     * administrator/auditor may ask. Nothing is audited.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<AccessDecisionResponse> evaluate(@RequestHeader("X-User-Id") String userId,
                                                           @RequestHeader(value = "X-User-Role", required = false) String role,
                                                           @Valid @RequestBody AccessCheckRequest request) {
        if (request.getPatientId() == null || request.getPatientId().isBlank()) {
            throw new BadRequestException("patientId is required");
        }
        return ResponseEntity.ok(AccessDecisionResponse.from(consentService.evaluate(userId,
                UserRole.fromHeader(role), request.getProviderId(),
                request.getPatientId(), request.getResourceType(), request.getAccessLevel())));
    }

    /**
     * Check one specific token, reporting revocation explicitly.
     */
    @PostMapping("/validate-token")
    public ResponseEntity<AccessDecisionResponse> validateToken(@RequestHeader("X-User-Id") String userId,
                                                                @RequestHeader(value = "X-User-Role", required = false) String role,
                                                                @Valid @RequestBody AccessCheckRequest request) {
        if (request.getTokenId() == null || request.getTokenId().isBlank()) {
            throw new BadRequestException("tokenId is required");
        }
        return ResponseEntity.ok(AccessDecisionResponse.from(consentService.validateToken(userId,
                UserRole.fromHeader(role), request.getTokenId(),
                request.getProviderId(), request.getResourceType(), request.getAccessLevel())));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<Map<String, Object>> cacheStats(@RequestHeader(value = "X-User-Role", required = false) String role) {
        requireAdmin(role);
        return ResponseEntity.ok(accessCache.stats());
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, Object>> clearCache(@RequestHeader(value = "X-User-Role", required = false) String role) {
        requireAdmin(role);
        accessCache.clear();
        return ResponseEntity.ok(Map.of("success", true, "message", "Caches cleared"));
    }

    private void requireAdmin(String role) {
        if (UserRole.fromHeader(role) != UserRole.ADMIN) {
            throw new ForbiddenException("Administrator role required");
        }
    }

    private List<ConsentTokenResponse> toResponses(List<ConsentToken> tokens) {
        Instant now = clock.instant();
        return tokens.stream().map(token -> ConsentTokenResponse.from(token, now)).collect(Collectors.toList());
    }
}
