package com.entity.linker.features;

import com.entity.linker.cache.CacheConfig;
import com.entity.linker.cache.CacheStats;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;

/**
 * Caffeine-backed memoization of hierarchy expansions.
 * Expansion against a remote or large hierarchy is expensive and the same codes recur across pairs.
 */
public class CachingOccupationHierarchy implements OccupationHierarchy {
    private static final Logger log = LoggerFactory.getLogger(CachingOccupationHierarchy.class);

    private final OccupationHierarchy delegate;
    private final Cache<String, Set<String>> cache;
    private final boolean enabled;

    public CachingOccupationHierarchy(OccupationHierarchy delegate, CacheConfig config) {
        this.delegate = delegate;
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingOccupationHierarchy initialized: enabled={}, maxSize={}, ttl={}s",
                enabled, config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Set<String> expand(String code) {
        if (!enabled) {
            return delegate.expand(code);
        }
        return cache.get(code, k -> Set.copyOf(delegate.expand(k)));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }
}
