package com.medledger.consentservice.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.medledger.consentservice.collaborators.SignatureProvider;
import com.medledger.consentservice.models.AuditEventType;
import com.medledger.consentservice.models.details.AuditDetails;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical serialization of audit entries. Details are written as JSON with sorted properties
 * and map keys, and the entry hash covers that stored JSON string verbatim, so the hash can be
 * recomputed from the row alone.
 */
@Component
@Slf4j
public class AuditHashing {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .findAndAddModules()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final SignatureProvider signatureProvider;

    public AuditHashing(SignatureProvider signatureProvider) {
        this.signatureProvider = signatureProvider;
    }

    public String canonicalDetails(AuditDetails details) {
        try {
            return canonicalMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit details cannot be serialized", e);
        }
    }

    /**
     * Parses stored details back into their typed form, or {@code null} when the stored JSON
     * is no longer readable (which integrity verification reports separately).
     */
    public AuditDetails readDetails(String detailsJson) {
        try {
            return canonicalMapper.readValue(detailsJson, AuditDetails.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored audit details are not readable: {}", e.getOriginalMessage());
            return null;
        }
    }

    public String canonicalContent(long blockNumber, AuditEventType eventType, String userId, String resourceId,
                                   Instant timestamp, String detailsJson, String previousHash) {
        Map<String, Object> content = new TreeMap<>();
        content.put("blockNumber", blockNumber);
        content.put("eventType", eventType.getValue());
        content.put("userId", userId);
        content.put("resourceId", resourceId);
        content.put("timestamp", timestamp.toEpochMilli());
        content.put("details", detailsJson);
        content.put("previousHash", previousHash);
        try {
            return canonicalMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit content cannot be serialized", e);
        }
    }

    public String entryHash(long blockNumber, AuditEventType eventType, String userId, String resourceId,
                            Instant timestamp, String detailsJson, String previousHash) {
        String content = canonicalContent(blockNumber, eventType, userId, resourceId, timestamp, detailsJson, previousHash);
        return signatureProvider.hash(content.getBytes(StandardCharsets.UTF_8));
    }
}
