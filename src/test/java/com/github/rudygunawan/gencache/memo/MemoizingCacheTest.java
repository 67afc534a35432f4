package com.github.rudygunawan.gencache.memo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.rudygunawan.gencache.builder.CacheBuilder;
import com.github.rudygunawan.gencache.model.CacheStats;
import com.github.rudygunawan.gencache.time.FakeTimeSource;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MemoizingCacheTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final FakeTimeSource time = new FakeTimeSource();

    @TempDir
    Path dir;

    private MemoizingCache newCache() {
        return CacheBuilder.newBuilder()
                .cacheDirectory(dir)
                .timeSource(time)
                .objectMapper(mapper)
                .buildMemoizing();
    }

    public static class Worksheet {
        public String title;
        public List<String> problems;

        public Worksheet() {
        }

        Worksheet(String title, List<String> problems) {
            this.title = title;
            this.problems = problems;
        }
    }

    public static class WorksheetRequest {
        final String subject;
        final String topic;
        final int grade;
        final String requestId;

        WorksheetRequest(String subject, String topic, int grade, String requestId) {
            this.subject = subject;
            this.topic = topic;
            this.grade = grade;
            this.requestId = requestId;
        }

        Map<String, Object> asParams() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("subject", subject);
            params.put("topic", topic);
            params.put("grade", grade);
            params.put("request_id", requestId);
            return params;
        }
    }

    @Test
    void testGeneratorRunsOncePerKey() throws Exception {
        MemoizingCache cache = newCache();
        AtomicInteger calls = new AtomicInteger();
        Map<String, Object> params = Map.of("subject", "math", "topic", "fractions");

        String first = cache.getOrGenerate("intro_page", params, String.class,
                () -> "intro #" + calls.incrementAndGet());
        String second = cache.getOrGenerate("intro_page", params, String.class,
                () -> "intro #" + calls.incrementAndGet());

        assertEquals("intro #1", first);
        assertEquals("intro #1", second);
        assertEquals(1, calls.get());
    }

    @Test
    void testDifferentParamsGenerateAgain() throws Exception {
        MemoizingCache cache = newCache();
        AtomicInteger calls = new AtomicInteger();

        cache.getOrGenerate("intro_page", Map.of("topic", "fractions"), String.class,
                () -> "v" + calls.incrementAndGet());
        String other = cache.getOrGenerate("intro_page", Map.of("topic", "decimals"), String.class,
                () -> "v" + calls.incrementAndGet());

        assertEquals("v2", other);
        assertEquals(2, calls.get());
    }

    @Test
    void testPojoValuesRoundTripThroughDisk() throws Exception {
        Map<String, Object> params = Map.of("topic", "fractions");
        newCache().getOrGenerate("worksheet", params, Worksheet.class,
                () -> new Worksheet("Fractions", List.of("1/2 + 1/4", "3/4 - 1/8")));

        Worksheet restored = newCache().getOrGenerate("worksheet", params, Worksheet.class,
                () -> fail("generator must not run after restart"));

        assertEquals("Fractions", restored.title);
        assertEquals(List.of("1/2 + 1/4", "3/4 - 1/8"), restored.problems);
    }

    @Test
    void testGeneratedEntryRecordsParams() throws Exception {
        MemoizingCache cache = newCache();
        Map<String, Object> params = Map.of("subject", "math", "grade", 3);

        cache.getOrGenerate("intro_page", params, String.class, () -> "hello");

        String key = cache.deriveKey("intro_page", params);
        JsonNode root = mapper.readTree(dir.resolve(key + ".json").toFile());
        assertEquals("hello", root.get("value").asText());
        assertEquals("math", root.get("params").get("subject").asText());
        assertEquals(3, root.get("params").get("grade").intValue());
    }

    @Test
    void testGeneratorExceptionPropagatesAndIsNotCached() throws Exception {
        MemoizingCache cache = newCache();
        Map<String, Object> params = Map.of("topic", "fractions");

        IOException thrown = assertThrows(IOException.class, () -> cache.getOrGenerate("intro_page", params,
                String.class, () -> {
                    throw new IOException("llm unavailable");
                }));
        assertEquals("llm unavailable", thrown.getMessage());

        assertEquals("recovered", cache.getOrGenerate("intro_page", params, String.class, () -> "recovered"));
        CacheStats stats = cache.synchronous().getStats();
        assertEquals(1, stats.generationFailureCount());
        assertEquals(1, stats.generationSuccessCount());
    }

    @Test
    void testNullResultIsRejected() {
        MemoizingCache cache = newCache();

        assertThrows(NullPointerException.class,
                () -> cache.getOrGenerate("intro_page", Map.of(), String.class, () -> null));
        assertEquals(0, cache.synchronous().getStats().fileEntries());
    }

    @Test
    void testTtlIsHonoured() throws Exception {
        MemoizingCache cache = newCache();
        AtomicInteger calls = new AtomicInteger();
        Map<String, Object> params = Map.of("topic", "fractions");

        cache.getOrGenerate("quiz", params, Integer.class, Duration.ofHours(1), calls::incrementAndGet);
        time.advance(30, TimeUnit.MINUTES);
        cache.getOrGenerate("quiz", params, Integer.class, Duration.ofHours(1), calls::incrementAndGet);
        time.advance(31, TimeUnit.MINUTES);
        int third = cache.getOrGenerate("quiz", params, Integer.class, Duration.ofHours(1), calls::incrementAndGet);

        assertEquals(2, third);
    }

    @Test
    void testUnconvertibleCachedValueIsRegenerated() throws Exception {
        MemoizingCache cache = newCache();
        Map<String, Object> params = Map.of("n", 1);
        String key = cache.deriveKey("count", params);
        cache.synchronous().set(key, TextNode.valueOf("not a number"));

        Integer value = cache.getOrGenerate("count", params, Integer.class, () -> 42);

        assertEquals(42, value);
        assertEquals(42, cache.synchronous().get(key).intValue());
    }

    @Test
    void testUnserializableResultIsReturnedUncached() throws Exception {
        MemoizingCache cache = newCache();
        Object opaque = new Object();

        Object value = cache.getOrGenerate("opaque", Map.of(), Object.class, () -> opaque);

        assertSame(opaque, value);
        assertEquals(0, cache.synchronous().getStats().memoryEntries());
    }

    @Test
    void testAsyncGeneration() {
        MemoizingCache cache = newCache();
        AtomicInteger calls = new AtomicInteger();
        Map<String, Object> params = Map.of("topic", "fractions");

        String first = cache.getOrGenerateAsync("intro_page", params, String.class,
                () -> CompletableFuture.supplyAsync(() -> "async #" + calls.incrementAndGet())).join();
        String second = cache.getOrGenerateAsync("intro_page", params, String.class,
                () -> CompletableFuture.supplyAsync(() -> "async #" + calls.incrementAndGet())).join();

        assertEquals("async #1", first);
        assertEquals("async #1", second);
        assertEquals(1, calls.get());
        // The future completes only after the write
        assertEquals("async #1", cache.synchronous().get(cache.deriveKey("intro_page", params)).asText());
    }

    @Test
    void testAsyncFailurePropagatesCause() {
        MemoizingCache cache = newCache();
        Map<String, Object> params = Map.of("topic", "fractions");
        IllegalStateException cause = new IllegalStateException("quota exceeded");

        CompletableFuture<String> failed = cache.getOrGenerateAsync("intro_page", params, String.class,
                () -> CompletableFuture.failedFuture(cause));

        ExecutionException e = assertThrows(ExecutionException.class, failed::get);
        assertSame(cause, e.getCause());
        assertEquals("fresh", cache.getOrGenerateAsync("intro_page", params, String.class,
                () -> CompletableFuture.completedFuture("fresh")).join());
    }

    @Test
    void testAsyncNullResultFails() {
        MemoizingCache cache = newCache();

        CompletableFuture<String> future = cache.getOrGenerateAsync("intro_page", Map.of(), String.class,
                () -> CompletableFuture.completedFuture(null));

        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(NullPointerException.class, e.getCause());
    }

    @Test
    void testMemoizeWithKeySubset() throws Exception {
        MemoizingCache cache = newCache();
        AtomicInteger calls = new AtomicInteger();
        // request_id differs per call and must not split the cache
        KeyExtractor<WorksheetRequest> byContent =
                KeyExtractor.only(WorksheetRequest::asParams, "subject", "topic", "grade");
        MemoizedFunction<WorksheetRequest, Worksheet> worksheets = cache.memoize(
                "worksheet", Worksheet.class, Duration.ofDays(3), byContent,
                request -> new Worksheet(request.topic + " #" + calls.incrementAndGet(), List.of()));

        Worksheet a = worksheets.apply(new WorksheetRequest("math", "fractions", 3, "req-1"));
        Worksheet b = worksheets.apply(new WorksheetRequest("math", "fractions", 3, "req-2"));
        Worksheet c = worksheets.apply(new WorksheetRequest("math", "fractions", 4, "req-3"));

        assertEquals("fractions #1", a.title);
        assertEquals("fractions #1", b.title);
        assertEquals("fractions #2", c.title);
        assertEquals(2, calls.get());
    }

    @Test
    void testMemoizeAsync() {
        MemoizingCache cache = newCache();
        AtomicInteger calls = new AtomicInteger();
        AsyncMemoizedFunction<String, String> summaries = cache.memoizeAsync(
                "summary", String.class, null,
                topic -> Map.of("topic", topic),
                topic -> CompletableFuture.supplyAsync(() -> topic.toUpperCase() + calls.incrementAndGet()));

        assertEquals("FRACTIONS1", summaries.apply("fractions").join());
        assertEquals("FRACTIONS1", summaries.apply("fractions").join());
        assertEquals("DECIMALS2", summaries.apply("decimals").join());
    }

    @Test
    void testKeyExtractorOnlySkipsAbsentNames() {
        KeyExtractor<Map<String, Object>> all = args -> args;
        KeyExtractor<Map<String, Object>> subset = KeyExtractor.only(all, "a", "missing");

        assertEquals(Map.of("a", 1), subset.extract(Map.of("a", 1, "b", 2)));
    }

    @Test
    void testBlankPrefixRejected() {
        MemoizingCache cache = newCache();

        assertThrows(IllegalArgumentException.class,
                () -> cache.memoize(" ", String.class, null, (String s) -> Map.of(), s -> s));
        assertThrows(IllegalArgumentException.class,
                () -> cache.getOrGenerate("", Map.of(), String.class, () -> "x"));
    }

    @Test
    void testInvalidTtlRejectedBeforeGenerating() {
        MemoizingCache cache = newCache();
        AtomicInteger calls = new AtomicInteger();
        Map<String, Object> params = Map.of("topic", "fractions");

        assertThrows(IllegalArgumentException.class, () -> cache.getOrGenerate("intro_page", params,
                String.class, Duration.ZERO, () -> "v" + calls.incrementAndGet()));
        assertThrows(IllegalArgumentException.class, () -> cache.getOrGenerateAsync("intro_page", params,
                String.class, Duration.ofSeconds(-1),
                () -> CompletableFuture.completedFuture("v" + calls.incrementAndGet())));
        assertThrows(IllegalArgumentException.class, () -> cache.memoize("intro_page", String.class,
                Duration.ZERO, (String topic) -> Map.of("topic", topic), topic -> "v" + calls.incrementAndGet()));
        assertThrows(IllegalArgumentException.class, () -> cache.memoizeAsync("intro_page", String.class,
                Duration.ZERO, (String topic) -> Map.of("topic", topic),
                topic -> CompletableFuture.completedFuture("v" + calls.incrementAndGet())));

        assertEquals(0, calls.get());
        CacheStats stats = cache.synchronous().getStats();
        assertEquals(0, stats.totalRequests());
        assertEquals(0, stats.generationSuccessCount());
    }

    @Test
    void testGenericResultKeepsElementTypeOnHit() throws Exception {
        TypeReference<List<Worksheet>> worksheetList = new TypeReference<List<Worksheet>>() {
        };
        Map<String, Object> params = Map.of("topic", "fractions", "count", 2);
        newCache().getOrGenerate("worksheet_set", params, worksheetList,
                () -> List.of(new Worksheet("Part 1", List.of("1/2 + 1/2")), new Worksheet("Part 2", List.of())));

        // A fresh instance must read the list back from disk
        List<Worksheet> restored = newCache().getOrGenerate("worksheet_set", params, worksheetList,
                () -> fail("generator must not run on a hit"));

        assertEquals(2, restored.size());
        assertInstanceOf(Worksheet.class, restored.get(0));
        assertEquals("Part 1", restored.get(0).title);
        assertEquals(List.of("1/2 + 1/2"), restored.get(0).problems);
    }

    @Test
    void testGenericResultAsyncAndMemoized() {
        MemoizingCache cache = newCache();
        TypeReference<Map<String, Worksheet>> byTopic = new TypeReference<Map<String, Worksheet>>() {
        };
        AtomicInteger calls = new AtomicInteger();
        AsyncMemoizedFunction<String, Map<String, Worksheet>> sets = cache.memoizeAsync(
                "worksheet_map", byTopic, null,
                topic -> Map.of("topic", topic),
                topic -> CompletableFuture.completedFuture(
                        Map.of(topic, new Worksheet(topic + " #" + calls.incrementAndGet(), List.of()))));

        sets.apply("fractions").join();
        Map<String, Worksheet> hit = sets.apply("fractions").join();

        assertEquals(1, calls.get());
        assertInstanceOf(Worksheet.class, hit.get("fractions"));
        assertEquals("fractions #1", hit.get("fractions").title);
    }
}
