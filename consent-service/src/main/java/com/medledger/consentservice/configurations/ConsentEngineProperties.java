package com.medledger.consentservice.configurations;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "consent")
@Getter
@Setter
public class ConsentEngineProperties {

    private final Cache cache = new Cache();
    private final Dependencies dependencies = new Dependencies();
    private final Access access = new Access();
    private final Signatures signatures = new Signatures();
    private final Audit audit = new Audit();
    private final Collaborators collaborators = new Collaborators();

    @Getter
    @Setter
    public static class Cache {
        /** Staleness bound for consent lookups; capped at 60 seconds. */
        private Duration grantsTtl = Duration.ofSeconds(30);
        private Duration recordMetadataTtl = Duration.ofSeconds(60);
        private long maximumSize = 10000;
        private long sweepIntervalMs = 60000;
    }

    @Getter
    @Setter
    public static class Dependencies {
        /** Default timeout for ledger, blob store and crypto calls. */
        private Duration timeout = Duration.ofSeconds(5);
        private int poolSize = 16;
    }

    @Getter
    @Setter
    public static class Access {
        /** Answer "record not found" with the same 403 as a consent denial. */
        private boolean collapseNotFound = true;
    }

    @Getter
    @Setter
    public static class Signatures {
        private boolean verifyGrants = true;
    }

    @Getter
    @Setter
    public static class Audit {
        private int verifyBatchSize = 500;
        private int maxAppendAttempts = 3;
        private boolean verifyLedgerAnchors = true;
    }

    @Getter
    @Setter
    public static class Collaborators {
        /** Accept the in-memory ledger and key directory even with an external database. */
        private boolean allowInMemory = false;
    }
}
