package com.entity.linker.cache;

/**
 * Snapshot of a lookup cache's counters.
 *
 * @param hitCount      lookups answered from the cache
 * @param missCount     lookups that had to be computed
 * @param evictionCount entries dropped by size or expiry
 * @param size          estimated number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long lookups = hitCount + missCount;
        return lookups == 0 ? 0.0 : (double) hitCount / lookups;
    }
}
