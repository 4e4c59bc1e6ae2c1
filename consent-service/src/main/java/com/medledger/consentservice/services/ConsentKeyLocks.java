package com.medledger.consentservice.services;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One read/write lock per (patient, provider) pair. Writers hold the write lock until their
 * transaction has committed and the pair's cache entry is gone, so a reader never observes
 * a consent change halfway. Locks are weakly held and disappear once no thread uses them.
 */
@Component
public class ConsentKeyLocks {

    private final LoadingCache<ConsentPairKey, ReentrantReadWriteLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantReadWriteLock());

    public ReentrantReadWriteLock lockFor(ConsentPairKey key) {
        return locks.get(key);
    }
}
