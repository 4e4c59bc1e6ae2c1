package com.medledger.consentservice.collaborators;

import java.security.PublicKey;

public interface KeyDirectory {

    PublicKey publicKeyFor(String keyRef);
}
