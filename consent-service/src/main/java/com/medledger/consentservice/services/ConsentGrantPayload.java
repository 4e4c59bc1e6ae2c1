package com.medledger.consentservice.services;

import com.medledger.consentservice.models.ConsentPermission;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The exact bytes a patient signs to grant consent. Clients must produce the same layout:
 * <pre>
 * consent-grant
 * patient=&lt;patientId&gt;
 * provider=&lt;providerId&gt;
 * permissions=&lt;resourceType:accessLevel,...&gt;
 * expires=&lt;ISO-8601 instant | never&gt;
 * </pre>
 */
public final class ConsentGrantPayload {

    private ConsentGrantPayload() {
    }

    public static String canonical(String patientId, String providerId,
                                   List<ConsentPermission> permissions, Instant expirationTime) {
        String joinedPermissions = permissions.stream()
                .map(ConsentPermission::toString)
                .collect(Collectors.joining(","));
        return "consent-grant\n"
                + "patient=" + patientId + "\n"
                + "provider=" + providerId + "\n"
                + "permissions=" + joinedPermissions + "\n"
                + "expires=" + (expirationTime != null ? expirationTime.toString() : "never");
    }

    public static byte[] bytes(String patientId, String providerId,
                               List<ConsentPermission> permissions, Instant expirationTime) {
        return canonical(patientId, providerId, permissions, expirationTime).getBytes(StandardCharsets.UTF_8);
    }
}
