package com.medledger.consentservice.services;

import lombok.Value;

/**
 * Identifies the (patient, provider) pair that consent locking and caching are keyed on.
 */
@Value(staticConstructor = "of")
public class ConsentPairKey {
    String patientId;
    String providerId;
}
