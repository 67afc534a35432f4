package com.github.rudygunawan.gencache.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.rudygunawan.gencache.model.CacheStats;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A non-blocking view of a {@link GenerationCache}. Every operation that may touch the disk runs on
 * the cache's executor, so callers on an event loop or other cooperative scheduler are never
 * stalled by file I/O.
 *
 * <p>Operations complete exceptionally only for programming errors (null arguments, invalid TTL).
 * Disk failures are logged and absorbed exactly as in the synchronous cache.
 */
public interface AsyncGenerationCache {

    /**
     * Returns a future for the value stored under {@code key}; completes with {@code null} on a miss.
     *
     * @param key the cache key
     * @return a future for the cached value
     */
    CompletableFuture<JsonNode> get(String key);

    /**
     * Stores {@code value} under {@code key} with the default time-to-live.
     *
     * @param key the cache key
     * @param value the value to cache
     * @return a future that completes when both tiers have been written
     */
    CompletableFuture<Void> set(String key, JsonNode value);

    /**
     * Stores {@code value} under {@code key} with a time-to-live and metadata.
     *
     * @param key the cache key
     * @param value the value to cache
     * @param ttl the time-to-live, or {@code null} for the default
     * @param metadata extra fields to persist with the entry, may be empty
     * @return a future that completes when both tiers have been written
     */
    CompletableFuture<Void> set(String key, JsonNode value, Duration ttl, Map<String, JsonNode> metadata);

    /**
     * Discards any entry for {@code key} in both tiers.
     */
    CompletableFuture<Void> invalidate(String key);

    /**
     * Discards every entry whose key starts with {@code prefix + "_"}.
     *
     * @return a future for the number of entries removed
     */
    CompletableFuture<Integer> invalidatePrefix(String prefix);

    /**
     * Discards every entry in both tiers.
     *
     * @return a future for the approximate number of entries removed
     */
    CompletableFuture<Integer> clearAll();

    /**
     * Removes expired entries and corrupt files.
     *
     * @return a future for the number of entries removed
     */
    CompletableFuture<Integer> clearExpired();

    /**
     * Returns a future for a statistics snapshot. Counting files lists the cache directory.
     */
    CompletableFuture<CacheStats> getStats();

    /**
     * Zeroes every statistics counter. This does not touch the disk and completes immediately.
     */
    void resetStats();

    /**
     * Returns the synchronous cache backing this view. Operations on either are reflected in the
     * other.
     */
    GenerationCache synchronous();

    /**
     * Returns the executor tier operations run on.
     */
    Executor executor();
}
