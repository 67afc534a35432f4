package com.github.rudygunawan.gencache.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.rudygunawan.gencache.model.CacheStats;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * A two-tier cache for generated content: a bounded in-memory tier in front of a durable
 * one-file-per-key tier. Entries are JSON trees and expire a fixed time after they were written.
 *
 * <p>Reads check memory first, then disk; a value found on disk is promoted into memory. Writes go
 * to both tiers with one shared expiration instant. Durability is best-effort: if the disk tier is
 * unavailable or a write fails, the failure is logged and the cache keeps working from memory.
 *
 * <p>Implementations of this interface are expected to be thread-safe. Entries are not locked
 * against other processes sharing the same directory.
 */
public interface GenerationCache {

    /**
     * Returns the value stored under {@code key}, or {@code null} if it is absent or expired.
     * Every call counts as exactly one memory hit, file hit or miss.
     *
     * @param key the cache key
     * @return a copy of the cached value, or {@code null}
     */
    JsonNode get(String key);

    /**
     * Stores {@code value} under {@code key} with the default time-to-live.
     *
     * @param key the cache key
     * @param value the value to cache
     */
    void set(String key, JsonNode value);

    /**
     * Stores {@code value} under {@code key} with the given time-to-live.
     *
     * @param key the cache key
     * @param value the value to cache
     * @param ttl the time-to-live, or {@code null} for the default
     * @throws IllegalArgumentException if {@code ttl} is zero or negative
     */
    void set(String key, JsonNode value, Duration ttl);

    /**
     * Stores {@code value} under {@code key} together with caller metadata. The metadata is written
     * to the entry file next to the value; names reserved by the file format are ignored.
     *
     * @param key the cache key
     * @param value the value to cache
     * @param ttl the time-to-live, or {@code null} for the default
     * @param metadata extra fields to persist with the entry, may be empty
     * @throws IllegalArgumentException if {@code ttl} is zero or negative
     */
    void set(String key, JsonNode value, Duration ttl, Map<String, JsonNode> metadata);

    /**
     * Discards any entry for {@code key} in both tiers. Invalidating an absent key is a no-op.
     *
     * @param key the cache key
     */
    void invalidate(String key);

    /**
     * Discards every entry whose key starts with {@code prefix + "_"}.
     *
     * @param prefix the key prefix, e.g. {@code "intro_page"}
     * @return the number of memory entries plus entry files removed
     */
    int invalidatePrefix(String prefix);

    /**
     * Discards every entry in both tiers.
     *
     * @return the approximate number of entries removed, memory and disk counted separately
     */
    int clearAll();

    /**
     * Removes every entry that has expired as of now from both tiers. Corrupt entry files found
     * on disk are deleted and counted.
     *
     * @return the number of entries and files removed
     */
    int clearExpired();

    /**
     * Returns a snapshot of this cache's statistics. The file entry count is taken from a
     * directory listing at call time.
     *
     * @return the cache statistics
     */
    CacheStats getStats();

    /**
     * Zeroes every statistics counter.
     */
    void resetStats();

    /**
     * Returns the time-to-live applied when none is given.
     */
    Duration defaultTtl();

    /**
     * Returns the root directory of the file tier.
     */
    Path cacheDirectory();
}
