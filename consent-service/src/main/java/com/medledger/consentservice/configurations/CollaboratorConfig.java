package com.medledger.consentservice.configurations;

import com.medledger.consentservice.collaborators.BlobStore;
import com.medledger.consentservice.collaborators.Ed25519SignatureProvider;
import com.medledger.consentservice.collaborators.InMemoryBlobStore;
import com.medledger.consentservice.collaborators.InMemoryKeyDirectory;
import com.medledger.consentservice.collaborators.InMemoryLedgerClient;
import com.medledger.consentservice.collaborators.KeyDirectory;
import com.medledger.consentservice.collaborators.LedgerClient;
import com.medledger.consentservice.collaborators.SignatureProvider;
import com.medledger.consentservice.collaborators.SigningKeySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.jdbc.EmbeddedDatabaseConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * In-process stand-ins for the ledger, blob store and key custody. Deployments register
 * their own beans for these interfaces and the defaults back off.
 *
 * <p>The in-memory ledger and key directory forget anchors and keys on restart, so audit rows
 * kept in an external database would no longer verify. They refuse to start against a
 * non-embedded datasource unless {@code consent.collaborators.allow-in-memory} is set.
 */
@Configuration
@Slf4j
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean(LedgerClient.class)
    public LedgerClient ledgerClient(Clock clock, ConsentEngineProperties properties,
                                     ObjectProvider<DataSource> dataSource) {
        requireEphemeralStorage("LedgerClient", properties, dataSource);
        log.warn("No LedgerClient configured, using the in-memory ledger");
        return new InMemoryLedgerClient(clock);
    }

    @Bean
    @ConditionalOnMissingBean(BlobStore.class)
    public BlobStore blobStore() {
        log.warn("No BlobStore configured, using the in-memory blob store");
        return new InMemoryBlobStore();
    }

    @Bean
    @ConditionalOnMissingBean(KeyDirectory.class)
    public InMemoryKeyDirectory keyDirectory(ConsentEngineProperties properties, ObjectProvider<DataSource> dataSource) {
        requireEphemeralStorage("KeyDirectory", properties, dataSource);
        log.warn("No KeyDirectory configured, generating in-memory Ed25519 keys");
        return new InMemoryKeyDirectory();
    }

    @Bean
    @ConditionalOnMissingBean(SignatureProvider.class)
    public SignatureProvider signatureProvider(ObjectProvider<SigningKeySource> signingKeys) {
        SigningKeySource keys = signingKeys.getIfUnique();
        if (keys == null) {
            throw new IllegalStateException("The default Ed25519 SignatureProvider needs exactly one SigningKeySource bean; "
                    + "register one next to the custom KeyDirectory or register a SignatureProvider");
        }
        return new Ed25519SignatureProvider(keys);
    }

    private void requireEphemeralStorage(String collaborator, ConsentEngineProperties properties,
                                         ObjectProvider<DataSource> dataSource) {
        if (properties.getCollaborators().isAllowInMemory()) {
            return;
        }
        DataSource available = dataSource.getIfAvailable();
        if (available != null && !EmbeddedDatabaseConnection.isEmbedded(available)) {
            throw new IllegalStateException("In-memory " + collaborator + " cannot back audit entries stored in an "
                    + "external database; register a " + collaborator + " bean or set consent.collaborators.allow-in-memory");
        }
    }
}
