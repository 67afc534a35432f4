package com.github.rudygunawan.gencache.metrics;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by MicrometerCacheMetrics to collect and expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the number of lookups served from the memory tier.
     */
    long memoryHitCount();

    /**
     * Returns the number of lookups served from the file tier.
     */
    long fileHitCount();

    /**
     * Returns the number of lookups served by neither tier.
     */
    long missCount();

    /**
     * Returns the number of memory entries evicted by the size bound.
     */
    long evictionCount();

    /**
     * Returns the number of generator calls that produced a value.
     */
    long generationSuccessCount();

    /**
     * Returns the number of generator calls that threw.
     */
    long generationFailureCount();

    /**
     * Returns the total time spent in generators in nanoseconds.
     */
    long totalGenerationTimeNanos();

    /**
     * Returns the current number of entries in the memory tier.
     */
    long memoryEntryCount();

    /**
     * Returns the number of entry files in the cache directory. This lists the directory and may
     * be slow for very large caches.
     */
    long fileEntryCount();

    /**
     * Returns the total number of hits across both tiers.
     */
    default long hitCount() {
        return memoryHitCount() + fileHitCount();
    }
}
