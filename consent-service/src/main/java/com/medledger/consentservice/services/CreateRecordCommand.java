package com.medledger.consentservice.services;

import com.medledger.consentservice.models.ResourceType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CreateRecordCommand {
    String uploaderId;
    String patientId;
    ResourceType resourceType;
    String title;
    String description;
    String mimeType;
    String encryptionKeyHash;
    byte[] ciphertext;
}
