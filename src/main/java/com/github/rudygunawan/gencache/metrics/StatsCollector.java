package com.github.rudygunawan.gencache.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic hit, miss, eviction and generation counters for one cache instance.
 *
 * <p>Counters only move forward until {@link #reset()} is called. All methods are thread-safe;
 * a reset racing with increments may lose those increments.
 */
public final class StatsCollector {

    private final AtomicLong memoryHits = new AtomicLong(0);
    private final AtomicLong fileHits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);
    private final AtomicLong generationSuccesses = new AtomicLong(0);
    private final AtomicLong generationFailures = new AtomicLong(0);
    private final AtomicLong totalGenerationTime = new AtomicLong(0);

    public void recordMemoryHit() {
        memoryHits.incrementAndGet();
    }

    public void recordFileHit() {
        fileHits.incrementAndGet();
    }

    public void recordMiss() {
        misses.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    /**
     * Records a generator call that produced a value.
     *
     * @param elapsedNanos time spent in the generator
     */
    public void recordGenerationSuccess(long elapsedNanos) {
        generationSuccesses.incrementAndGet();
        totalGenerationTime.addAndGet(elapsedNanos);
    }

    /**
     * Records a generator call that threw.
     *
     * @param elapsedNanos time spent in the generator
     */
    public void recordGenerationFailure(long elapsedNanos) {
        generationFailures.incrementAndGet();
        totalGenerationTime.addAndGet(elapsedNanos);
    }

    public long memoryHits() {
        return memoryHits.get();
    }

    public long fileHits() {
        return fileHits.get();
    }

    public long misses() {
        return misses.get();
    }

    public long evictions() {
        return evictions.get();
    }

    public long generationSuccesses() {
        return generationSuccesses.get();
    }

    public long generationFailures() {
        return generationFailures.get();
    }

    public long totalGenerationTimeNanos() {
        return totalGenerationTime.get();
    }

    /**
     * Zeroes every counter.
     */
    public void reset() {
        memoryHits.set(0);
        fileHits.set(0);
        misses.set(0);
        evictions.set(0);
        generationSuccesses.set(0);
        generationFailures.set(0);
        totalGenerationTime.set(0);
    }
}
