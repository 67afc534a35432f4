package com.github.rudygunawan.gencache.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Statistics about the performance of a generation cache. Instances of this class are immutable
 * snapshots.
 *
 * <p>Counters are incremented according to the following rules:
 *
 * <ul>
 *   <li>A lookup served from memory increments {@code memoryHits}.
 *   <li>A lookup served from disk (and promoted to memory) increments {@code fileHits}.
 *   <li>A lookup served by neither tier increments {@code misses}.
 *   <li>A memory entry pushed out by the size bound increments {@code evictionCount}.
 *   <li>A generator invoked on a miss increments {@code generationSuccessCount} or
 *       {@code generationFailureCount}.
 * </ul>
 *
 * <p>{@code memoryEntries} and {@code fileEntries} are sampled when the snapshot is taken; the
 * file count comes from a directory listing and is only eventually consistent with concurrent
 * writers.
 */
public class CacheStats {
    private final long memoryHits;
    private final long fileHits;
    private final long misses;
    private final long evictionCount;
    private final long generationSuccessCount;
    private final long generationFailureCount;
    private final long totalGenerationTimeNanos;
    private final long memoryEntries;
    private final long fileEntries;
    private final String cacheDirectory;

    /**
     * Constructs a new {@code CacheStats} instance.
     */
    public CacheStats(
            long memoryHits,
            long fileHits,
            long misses,
            long evictionCount,
            long generationSuccessCount,
            long generationFailureCount,
            long totalGenerationTimeNanos,
            long memoryEntries,
            long fileEntries,
            String cacheDirectory) {
        this.memoryHits = memoryHits;
        this.fileHits = fileHits;
        this.misses = misses;
        this.evictionCount = evictionCount;
        this.generationSuccessCount = generationSuccessCount;
        this.generationFailureCount = generationFailureCount;
        this.totalGenerationTimeNanos = totalGenerationTimeNanos;
        this.memoryEntries = memoryEntries;
        this.fileEntries = fileEntries;
        this.cacheDirectory = cacheDirectory;
    }

    public long memoryHits() {
        return memoryHits;
    }

    public long fileHits() {
        return fileHits;
    }

    /**
     * Returns {@code memoryHits + fileHits}.
     */
    public long totalHits() {
        return memoryHits + fileHits;
    }

    public long misses() {
        return misses;
    }

    /**
     * Returns the number of lookups, {@code totalHits + misses}.
     */
    public long totalRequests() {
        return totalHits() + misses;
    }

    /**
     * Returns the hit rate as a percentage in the range 0 to 100, rounded to two decimals, or
     * {@code 0.0} when no request has been made.
     */
    public double hitRate() {
        long total = totalRequests();
        if (total == 0) {
            return 0.0;
        }
        double percent = (double) totalHits() / total * 100.0;
        return Math.round(percent * 100.0) / 100.0;
    }

    public long evictionCount() {
        return evictionCount;
    }

    public long generationSuccessCount() {
        return generationSuccessCount;
    }

    public long generationFailureCount() {
        return generationFailureCount;
    }

    /**
     * Returns the total number of nanoseconds spent inside generators.
     */
    public long totalGenerationTimeNanos() {
        return totalGenerationTimeNanos;
    }

    public long memoryEntries() {
        return memoryEntries;
    }

    public long fileEntries() {
        return fileEntries;
    }

    public String cacheDirectory() {
        return cacheDirectory;
    }

    /**
     * Returns the statistics as a flat, insertion-ordered map with snake_case names, suitable for
     * serving from an operational endpoint.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("memory_hits", memoryHits);
        map.put("file_hits", fileHits);
        map.put("total_hits", totalHits());
        map.put("misses", misses);
        map.put("total_requests", totalRequests());
        map.put("hit_rate", hitRate());
        map.put("memory_entries", memoryEntries);
        map.put("file_entries", fileEntries);
        map.put("cache_dir", cacheDirectory);
        return map;
    }

    @Override
    public int hashCode() {
        return Objects.hash(memoryHits, fileHits, misses, evictionCount, generationSuccessCount,
                generationFailureCount, totalGenerationTimeNanos, memoryEntries, fileEntries, cacheDirectory);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return memoryHits == other.memoryHits
                && fileHits == other.fileHits
                && misses == other.misses
                && evictionCount == other.evictionCount
                && generationSuccessCount == other.generationSuccessCount
                && generationFailureCount == other.generationFailureCount
                && totalGenerationTimeNanos == other.totalGenerationTimeNanos
                && memoryEntries == other.memoryEntries
                && fileEntries == other.fileEntries
                && Objects.equals(cacheDirectory, other.cacheDirectory);
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "memoryHits=" + memoryHits
                + ", fileHits=" + fileHits
                + ", misses=" + misses
                + ", evictionCount=" + evictionCount
                + ", generationSuccessCount=" + generationSuccessCount
                + ", generationFailureCount=" + generationFailureCount
                + ", memoryEntries=" + memoryEntries
                + ", fileEntries=" + fileEntries
                + ", hitRate=" + String.format("%.2f%%", hitRate())
                + '}';
    }
}
