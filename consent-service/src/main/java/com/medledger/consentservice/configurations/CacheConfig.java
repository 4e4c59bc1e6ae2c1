package com.medledger.consentservice.configurations;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.medledger.consentservice.aspects.RateLimitAspect;
import com.medledger.consentservice.models.ConsentToken;
import com.medledger.consentservice.services.ConsentPairKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine caches in front of the consent store and record metadata lookups.
 * Consent entries are invalidated explicitly on every grant and revoke; the TTL only
 * bounds staleness for anything that slips past invalidation.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String RECORD_METADATA_CACHE = "recordMetadata";

    private static final Duration MAX_GRANTS_TTL = Duration.ofSeconds(60);

    @Bean
    public CacheManager cacheManager(ConsentEngineProperties properties) {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(properties.getCache().getRecordMetadataTtl())
                .maximumSize(properties.getCache().getMaximumSize())
                .recordStats());
        cacheManager.setCacheNames(List.of(RECORD_METADATA_CACHE));
        return cacheManager;
    }

    /**
     * Unrevoked consent tokens per (patient, provider) pair.
     */
    @Bean
    public Cache<ConsentPairKey, List<ConsentToken>> consentGrantsCache(ConsentEngineProperties properties) {
        Duration ttl = properties.getCache().getGrantsTtl();
        if (ttl.compareTo(MAX_GRANTS_TTL) > 0) {
            log.warn("consent.cache.grants-ttl of {} exceeds {}; using the maximum", ttl, MAX_GRANTS_TTL);
            ttl = MAX_GRANTS_TTL;
        }
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(properties.getCache().getMaximumSize())
                .recordStats()
                .build();
    }

    /**
     * Rate limiting buckets, 60-second TTL to match the widest rate limit window.
     */
    @Bean
    public Cache<String, RateLimitAspect.RateLimitBucket> rateLimitCache() {
        return Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.SECONDS)
                .maximumSize(50000)
                .build();
    }
}
