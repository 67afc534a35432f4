package com.github.rudygunawan.gencache.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.rudygunawan.gencache.api.GenerationCache;
import com.github.rudygunawan.gencache.builder.CacheBuilder;
import com.github.rudygunawan.gencache.metrics.CacheMetrics;
import com.github.rudygunawan.gencache.metrics.StatsCollector;
import com.github.rudygunawan.gencache.model.CacheEntry;
import com.github.rudygunawan.gencache.model.CacheStats;
import com.github.rudygunawan.gencache.tier.FileTier;
import com.github.rudygunawan.gencache.tier.MemoryTier;
import com.github.rudygunawan.gencache.time.TimeSource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link GenerationCache} backed by a {@link MemoryTier} and a {@link FileTier}.
 *
 * <p>Logging: This class uses java.util.logging. See {@link #LOGGER} for the logger name.
 */
public class TieredGenerationCache implements GenerationCache, CacheMetrics {
    /**
     * Logger for cache operations. Logger name: "com.github.rudygunawan.gencache.Cache"
     *
     * <p>Log levels used:
     * <ul>
     *   <li>WARNING: Disk tier degraded (directory, read or write failures, corrupt files)</li>
     *   <li>INFO: Bulk invalidation and cleanup summaries</li>
     *   <li>FINE: Promotions, evictions, file writes</li>
     *   <li>FINER: Entry-level hits and misses</li>
     * </ul>
     */
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.gencache.Cache");

    private final MemoryTier memoryTier;
    private final FileTier fileTier;
    private final StatsCollector stats;
    private final TimeSource timeSource;
    private final Duration defaultTtl;

    /**
     * Creates a cache configured by {@code builder}, recording into {@code stats}.
     */
    public TieredGenerationCache(CacheBuilder builder, StatsCollector stats) {
        this.stats = Objects.requireNonNull(stats, "stats cannot be null");
        this.timeSource = builder.getTimeSource();
        this.defaultTtl = builder.getDefaultTtl();
        this.memoryTier = new MemoryTier(builder.getMaximumMemoryEntries(), key -> stats.recordEviction());
        this.fileTier = new FileTier(builder.getCacheDirectory(), builder.getObjectMapper());
    }

    @Override
    public JsonNode get(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        long now = timeSource.currentTimeMillis();

        CacheEntry entry = memoryTier.get(key);
        if (entry != null) {
            if (!entry.isExpiredAt(now)) {
                stats.recordMemoryHit();
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Memory cache hit: " + key);
                }
                return entry.getValue();
            }
            memoryTier.remove(key, entry);
        }

        // Expired files are deleted by the tier itself
        entry = fileTier.get(key, now);
        if (entry != null) {
            CacheEntry current = memoryTier.putIfAbsent(entry, now);
            if (current != null) {
                entry = current;
            } else if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Promoted file entry to memory: " + key);
            }
            stats.recordFileHit();
            return entry.getValue();
        }

        stats.recordMiss();
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Cache miss: " + key);
        }
        return null;
    }

    @Override
    public void set(String key, JsonNode value) {
        set(key, value, null, Collections.emptyMap());
    }

    @Override
    public void set(String key, JsonNode value, Duration ttl) {
        set(key, value, ttl, Collections.emptyMap());
    }

    @Override
    public void set(String key, JsonNode value, Duration ttl, Map<String, JsonNode> metadata) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Duration effectiveTtl = ttl == null ? defaultTtl : ttl;
        if (effectiveTtl.isZero() || effectiveTtl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + effectiveTtl);
        }

        // One expiry instant for both tiers
        long now = timeSource.currentTimeMillis();
        long expiresAt = saturatedAdd(now, effectiveTtl.toMillis());
        CacheEntry entry = new CacheEntry(key, value, expiresAt, now, metadata);

        memoryTier.put(entry);
        fileTier.put(entry);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Cached value for: " + key + " (TTL: " + effectiveTtl + ")");
        }
    }

    @Override
    public void invalidate(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        memoryTier.remove(key);
        fileTier.remove(key);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Invalidated cache entry: " + key);
        }
    }

    @Override
    public int invalidatePrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        String keyPrefix = prefix + "_";
        int count = memoryTier.removeByPrefix(keyPrefix) + fileTier.removeByPrefix(keyPrefix);
        LOGGER.info("Invalidated " + count + " cache entries with prefix: " + prefix);
        return count;
    }

    @Override
    public int clearAll() {
        int count = memoryTier.clear() + fileTier.clear();
        LOGGER.info("Cleared " + count + " cache entries");
        return count;
    }

    @Override
    public int clearExpired() {
        long now = timeSource.currentTimeMillis();
        int count = memoryTier.removeExpired(now) + fileTier.sweepExpired(now);
        if (count > 0) {
            LOGGER.info("Cleared " + count + " expired cache entries");
        }
        return count;
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(
                stats.memoryHits(),
                stats.fileHits(),
                stats.misses(),
                stats.evictions(),
                stats.generationSuccesses(),
                stats.generationFailures(),
                stats.totalGenerationTimeNanos(),
                memoryTier.size(),
                fileTier.count(),
                fileTier.directory().toString());
    }

    @Override
    public void resetStats() {
        stats.reset();
    }

    @Override
    public Duration defaultTtl() {
        return defaultTtl;
    }

    @Override
    public Path cacheDirectory() {
        return fileTier.directory();
    }

    /**
     * Returns the keys currently held in memory, least recently used first.
     */
    public List<String> memoryKeys() {
        return memoryTier.keys();
    }

    /**
     * Returns true if the cache directory exists or could be created.
     */
    public boolean isFileTierAvailable() {
        return fileTier.isAvailable();
    }

    // ========== CacheMetrics ==========

    @Override
    public long memoryHitCount() {
        return stats.memoryHits();
    }

    @Override
    public long fileHitCount() {
        return stats.fileHits();
    }

    @Override
    public long missCount() {
        return stats.misses();
    }

    @Override
    public long evictionCount() {
        return stats.evictions();
    }

    @Override
    public long generationSuccessCount() {
        return stats.generationSuccesses();
    }

    @Override
    public long generationFailureCount() {
        return stats.generationFailures();
    }

    @Override
    public long totalGenerationTimeNanos() {
        return stats.totalGenerationTimeNanos();
    }

    @Override
    public long memoryEntryCount() {
        return memoryTier.size();
    }

    @Override
    public long fileEntryCount() {
        return fileTier.count();
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        // Overflow iff both operands have the same sign and the result's sign differs
        if (((a ^ r) & (b ^ r)) < 0) {
            return Long.MAX_VALUE;
        }
        return r;
    }
}
