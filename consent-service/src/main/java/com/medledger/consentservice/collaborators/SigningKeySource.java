package com.medledger.consentservice.collaborators;

import java.security.PrivateKey;

/**
 * Private half of key custody, used by the default Ed25519 signer.
 */
public interface SigningKeySource {

    PrivateKey privateKeyFor(String keyRef);
}
