package com.github.rudygunawan.gencache.impl;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.rudygunawan.gencache.api.AsyncGenerationCache;
import com.github.rudygunawan.gencache.builder.CacheBuilder;
import com.github.rudygunawan.gencache.model.CacheStats;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the non-blocking cache view.
 */
class AsyncGenerationCacheTest {

    @TempDir
    Path dir;

    @Test
    void testAsyncBasicOperations() {
        AsyncGenerationCache cache = CacheBuilder.newBuilder()
                .cacheDirectory(dir)
                .buildAsync();

        cache.set("k1", TextNode.valueOf("v1")).join();
        assertEquals("v1", cache.get("k1").join().asText());
        assertNull(cache.get("missing").join());

        cache.invalidate("k1").join();
        assertNull(cache.get("k1").join());
    }

    @Test
    void testOperationsRunOnExecutor() {
        AtomicInteger submitted = new AtomicInteger();
        Executor counting = task -> {
            submitted.incrementAndGet();
            task.run();
        };
        AsyncGenerationCache cache = CacheBuilder.newBuilder()
                .cacheDirectory(dir)
                .executor(counting)
                .buildAsync();

        cache.set("k", IntNode.valueOf(1), Duration.ofMinutes(5), Map.of()).join();
        cache.get("k").join();
        cache.getStats().join();
        cache.clearExpired().join();

        assertEquals(4, submitted.get());
        assertSame(counting, cache.executor());
    }

    @Test
    void testDefaultExecutorUsesNamedDaemonThreads() {
        AsyncGenerationCache cache = CacheBuilder.newBuilder()
                .cacheDirectory(dir)
                .buildAsync();

        Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, cache.executor()).join();

        assertTrue(worker.isDaemon());
        assertTrue(worker.getName().startsWith("gencache-io-"), worker.getName());
    }

    @Test
    void testBulkOperations() {
        AsyncGenerationCache cache = CacheBuilder.newBuilder()
                .cacheDirectory(dir)
                .buildAsync();

        CompletableFuture.allOf(
                cache.set("intro_page_1", TextNode.valueOf("a")),
                cache.set("intro_page_2", TextNode.valueOf("b")),
                cache.set("worksheet_1", TextNode.valueOf("c"))).join();

        assertEquals(4, cache.invalidatePrefix("intro_page").join());
        assertEquals(2, cache.clearAll().join());
    }

    @Test
    void testViewsShareState() {
        AsyncGenerationCache cache = CacheBuilder.newBuilder()
                .cacheDirectory(dir)
                .buildAsync();

        cache.synchronous().set("k", TextNode.valueOf("sync"));
        assertEquals("sync", cache.get("k").join().asText());

        CacheStats stats = cache.getStats().join();
        assertEquals(1, stats.memoryHits());

        cache.resetStats();
        assertEquals(0, cache.synchronous().getStats().totalRequests());
    }

    @Test
    void testInvalidTtlFailsFuture() {
        AsyncGenerationCache cache = CacheBuilder.newBuilder()
                .cacheDirectory(dir)
                .buildAsync();

        CompletableFuture<Void> future = cache.set("k", TextNode.valueOf("v"), Duration.ZERO, Map.of());

        Exception e = assertThrows(Exception.class, future::join);
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }
}
