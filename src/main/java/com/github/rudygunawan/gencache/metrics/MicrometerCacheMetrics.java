package com.github.rudygunawan.gencache.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.FunctionTimer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer integration for generation cache metrics.
 * Binds cache statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics:
 * <ul>
 *   <li>cache.hits{tier=memory|file} - Lookups served by each tier
 *   <li>cache.misses - Lookups served by neither tier
 *   <li>cache.requests - Total lookups
 *   <li>cache.hit.ratio - Hit rate (0.0 to 1.0)
 *   <li>cache.size{tier=memory|file} - Current number of entries per tier
 *   <li>cache.evictions - Memory entries evicted by the size bound
 *   <li>cache.generations{result=success|failure} - Generator invocations
 *   <li>cache.generation.duration - Time spent in generators
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * TieredGenerationCache cache = (TieredGenerationCache) CacheBuilder.newBuilder()
 *     .cacheDirectory(dir)
 *     .build();
 *
 * MicrometerCacheMetrics.monitor(registry, cache, "llm");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a cache with Micrometer.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param <C> the cache type
     * @return the cache (for chaining)
     */
    public static <C extends CacheMetrics> C monitor(MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a cache with Micrometer with additional tags.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param tags additional tags
     * @param <C> the cache type
     * @return the cache (for chaining)
     */
    public static <C extends CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::memoryHitCount)
                .tags(allTags.and("tier", "memory"))
                .description("Number of lookups served from memory")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::fileHitCount)
                .tags(allTags.and("tier", "file"))
                .description("Number of lookups served from disk")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Number of lookups served by neither tier")
                .register(registry);

        FunctionCounter.builder("cache.requests", cache, c -> c.hitCount() + c.missCount())
                .tags(allTags)
                .description("Total number of cache lookups")
                .register(registry);

        Gauge.builder("cache.hit.ratio", cache, c -> {
                    long hits = c.hitCount();
                    long total = hits + c.missCount();
                    return total == 0 ? 0.0 : (double) hits / total;
                })
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);

        Gauge.builder("cache.size", cache, CacheMetrics::memoryEntryCount)
                .tags(allTags.and("tier", "memory"))
                .description("Current number of entries in memory")
                .register(registry);

        // Lists the cache directory on every scrape
        Gauge.builder("cache.size", cache, CacheMetrics::fileEntryCount)
                .tags(allTags.and("tier", "file"))
                .description("Current number of entry files on disk")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Number of memory entries evicted by the size bound")
                .register(registry);

        FunctionCounter.builder("cache.generations", cache, CacheMetrics::generationSuccessCount)
                .tags(allTags.and("result", "success"))
                .description("Number of generator calls that produced a value")
                .register(registry);

        FunctionCounter.builder("cache.generations", cache, CacheMetrics::generationFailureCount)
                .tags(allTags.and("result", "failure"))
                .description("Number of generator calls that failed")
                .register(registry);

        FunctionTimer.builder("cache.generation.duration", cache,
                        c -> c.generationSuccessCount() + c.generationFailureCount(),
                        CacheMetrics::totalGenerationTimeNanos,
                        TimeUnit.NANOSECONDS)
                .tags(allTags)
                .description("Time spent generating values on cache misses")
                .register(registry);
    }
}
