package com.github.rudygunawan.gencache.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.rudygunawan.gencache.api.AsyncGenerationCache;
import com.github.rudygunawan.gencache.api.GenerationCache;
import com.github.rudygunawan.gencache.model.CacheStats;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Asynchronous wrapper around a synchronous {@link GenerationCache}.
 *
 * <p>This implementation delegates all operations to the underlying cache and runs them on the
 * supplied executor, wrapping the results in {@link CompletableFuture} instances.
 */
public class AsyncGenerationCacheImpl implements AsyncGenerationCache {

    private final GenerationCache cache;
    private final Executor executor;

    /**
     * Creates an async cache wrapper.
     *
     * @param cache the synchronous cache to wrap
     * @param executor the executor to run cache operations on
     */
    public AsyncGenerationCacheImpl(GenerationCache cache, Executor executor) {
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    @Override
    public CompletableFuture<JsonNode> get(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        return CompletableFuture.supplyAsync(() -> cache.get(key), executor);
    }

    @Override
    public CompletableFuture<Void> set(String key, JsonNode value) {
        return set(key, value, null, Collections.emptyMap());
    }

    @Override
    public CompletableFuture<Void> set(String key, JsonNode value, Duration ttl, Map<String, JsonNode> metadata) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        return CompletableFuture.runAsync(() -> cache.set(key, value, ttl, metadata), executor);
    }

    @Override
    public CompletableFuture<Void> invalidate(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        return CompletableFuture.runAsync(() -> cache.invalidate(key), executor);
    }

    @Override
    public CompletableFuture<Integer> invalidatePrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        return CompletableFuture.supplyAsync(() -> cache.invalidatePrefix(prefix), executor);
    }

    @Override
    public CompletableFuture<Integer> clearAll() {
        return CompletableFuture.supplyAsync(cache::clearAll, executor);
    }

    @Override
    public CompletableFuture<Integer> clearExpired() {
        return CompletableFuture.supplyAsync(cache::clearExpired, executor);
    }

    @Override
    public CompletableFuture<CacheStats> getStats() {
        return CompletableFuture.supplyAsync(cache::getStats, executor);
    }

    @Override
    public void resetStats() {
        cache.resetStats();
    }

    @Override
    public GenerationCache synchronous() {
        return cache;
    }

    @Override
    public Executor executor() {
        return executor;
    }
}
