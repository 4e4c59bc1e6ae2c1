package com.medledger.consentservice.services;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.medledger.consentservice.configurations.CacheConfig;
import com.medledger.consentservice.models.ConsentToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Cache layer in front of consent and record metadata lookups.
 * Consent entries hold the unrevoked tokens of a pair; expiration is always re-applied by the
 * reader, so a cached token that has since expired is never treated as live.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessCache {

    private final Cache<ConsentPairKey, List<ConsentToken>> consentGrantsCache;
    private final CacheManager cacheManager;

    public List<ConsentToken> unrevokedTokens(ConsentPairKey key, Function<ConsentPairKey, List<ConsentToken>> loader) {
        return consentGrantsCache.get(key, k -> {
            log.debug("Consent cache miss for patient {} provider {}", k.getPatientId(), k.getProviderId());
            return List.copyOf(loader.apply(k));
        });
    }

    public void invalidatePair(ConsentPairKey key) {
        consentGrantsCache.invalidate(key);
        log.debug("Invalidated consent cache for patient {} provider {}", key.getPatientId(), key.getProviderId());
    }

    public void clear() {
        consentGrantsCache.invalidateAll();
        org.springframework.cache.Cache metadata = cacheManager.getCache(CacheConfig.RECORD_METADATA_CACHE);
        if (metadata != null) {
            metadata.clear();
        }
        log.info("Cleared consent and record metadata caches");
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("consentGrants", describe(consentGrantsCache.estimatedSize(), consentGrantsCache.stats()));

        org.springframework.cache.Cache metadata = cacheManager.getCache(CacheConfig.RECORD_METADATA_CACHE);
        if (metadata != null && metadata.getNativeCache() instanceof Cache) {
            Cache<?, ?> nativeCache = (Cache<?, ?>) metadata.getNativeCache();
            stats.put(CacheConfig.RECORD_METADATA_CACHE, describe(nativeCache.estimatedSize(), nativeCache.stats()));
        }
        return stats;
    }

    /**
     * Evicts expired entries ahead of Caffeine's own maintenance. Correctness never depends on it.
     */
    @Scheduled(fixedDelayString = "${consent.cache.sweep-interval-ms:60000}")
    public void sweep() {
        consentGrantsCache.cleanUp();
        org.springframework.cache.Cache metadata = cacheManager.getCache(CacheConfig.RECORD_METADATA_CACHE);
        if (metadata != null && metadata.getNativeCache() instanceof Cache) {
            ((Cache<?, ?>) metadata.getNativeCache()).cleanUp();
        }
        log.debug("Cache sweep finished, {} consent pairs cached", consentGrantsCache.estimatedSize());
    }

    private Map<String, Object> describe(long size, CacheStats stats) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("size", size);
        description.put("hitCount", stats.hitCount());
        description.put("missCount", stats.missCount());
        description.put("hitRate", stats.hitRate());
        description.put("evictionCount", stats.evictionCount());
        return description;
    }
}
