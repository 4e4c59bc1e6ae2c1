package com.medledger.consentservice.services;

import com.medledger.consentservice.models.AuditEventType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
@Builder
public class AuditQuery {
    String userId;
    Set<AuditEventType> eventTypes;
    Instant from;
    Instant to;
    Integer pageSize;
    String pageToken;
}
