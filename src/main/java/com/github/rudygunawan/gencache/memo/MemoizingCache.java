package com.github.rudygunawan.gencache.memo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.rudygunawan.gencache.api.AsyncGenerationCache;
import com.github.rudygunawan.gencache.api.GenerationCache;
import com.github.rudygunawan.gencache.key.KeyDeriver;
import com.github.rudygunawan.gencache.metrics.StatsCollector;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Get-or-generate front end over an {@link AsyncGenerationCache}.
 *
 * <p>A call derives its key from a prefix and a map of parameters (see {@link KeyDeriver}), returns
 * the cached value if there is one, and otherwise runs the generator and stores its result together
 * with {@code {"params": ...}} metadata. Generator exceptions reach the caller unchanged and nothing
 * is cached for them. Arguments are validated before the cache is read, so an invalid prefix or
 * time-to-live never costs a generator call.
 *
 * <p>Results are converted back from JSON with the requested type. For generic results such as
 * {@code List<Worksheet>} pass a {@link TypeReference}; a plain {@code Class} only carries the
 * erased type, and a hit would then return maps where a miss returned beans.
 *
 * <p>Concurrent misses for the same key each run the generator; the last write wins.
 *
 * <p>Usage example:
 * <pre>{@code
 * MemoizedFunction<WorksheetRequest, Worksheet> worksheets = cache.memoize(
 *     "worksheet", Worksheet.class, Duration.ofDays(3),
 *     KeyExtractor.only(WorksheetRequest::asParams, "subject", "topic", "grade"),
 *     request -> llm.generateWorksheet(request));
 *
 * Worksheet sheet = worksheets.apply(request);
 * }</pre>
 *
 * <p>Logging: This class uses java.util.logging with logger name
 * "com.github.rudygunawan.gencache.Memo". Unusable cached values and values that cannot be stored
 * are logged at WARNING; generator runs at FINE.
 */
public class MemoizingCache {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.gencache.Memo");

    /** Metadata field holding the key parameters of a generated entry. */
    public static final String PARAMS_FIELD = "params";

    private final AsyncGenerationCache cache;
    private final ObjectMapper mapper;
    private final KeyDeriver keyDeriver;
    private final StatsCollector stats;

    /**
     * Creates a memoizing cache.
     *
     * @param cache the cache to store generated values in
     * @param mapper converts between generated values and JSON trees
     * @param stats the collector generation outcomes are recorded in, normally the one backing
     *        {@code cache}
     */
    public MemoizingCache(AsyncGenerationCache cache, ObjectMapper mapper, StatsCollector stats) {
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.stats = Objects.requireNonNull(stats, "stats cannot be null");
        this.keyDeriver = new KeyDeriver(mapper);
    }

    /**
     * Returns the cache key a call with {@code prefix} and {@code keyParams} reads and writes.
     */
    public String deriveKey(String prefix, Map<String, ?> keyParams) {
        return keyDeriver.derive(prefix, keyParams);
    }

    // ========== Blocking ==========

    /**
     * Returns the cached value for the key, or runs {@code generator} and caches its result with
     * the default time-to-live. Blocks the calling thread for cache I/O and generation.
     *
     * @see #getOrGenerate(String, Map, Class, Duration, Callable)
     */
    public <T> T getOrGenerate(String prefix, Map<String, ?> keyParams, Class<T> type, Callable<T> generator)
            throws Exception {
        return getOrGenerate(prefix, keyParams, type, null, generator);
    }

    /**
     * Returns the cached value for the key derived from {@code prefix} and {@code keyParams}, or
     * runs {@code generator} and caches its result.
     *
     * @param prefix the key prefix, e.g. {@code "intro_page"}
     * @param keyParams the parameters identifying the call
     * @param type the type the cached JSON is converted to
     * @param ttl the time-to-live of a generated entry, or {@code null} for the default
     * @param generator produces the value on a miss
     * @param <T> the value type
     * @return the cached or generated value
     * @throws IllegalArgumentException if {@code prefix} is blank or {@code ttl} is not positive
     * @throws NullPointerException if the generator returns {@code null}
     * @throws Exception whatever {@code generator} throws
     */
    public <T> T getOrGenerate(String prefix, Map<String, ?> keyParams, Class<T> type, Duration ttl,
                               Callable<T> generator) throws Exception {
        Objects.requireNonNull(type, "type cannot be null");
        return load(prefix, keyParams, mapper.constructType(type), ttl, generator);
    }

    /**
     * Generic-type variant of {@link #getOrGenerate(String, Map, Class, Callable)}.
     */
    public <T> T getOrGenerate(String prefix, Map<String, ?> keyParams, TypeReference<T> type,
                               Callable<T> generator) throws Exception {
        return getOrGenerate(prefix, keyParams, type, null, generator);
    }

    /**
     * Generic-type variant of {@link #getOrGenerate(String, Map, Class, Duration, Callable)}.
     */
    public <T> T getOrGenerate(String prefix, Map<String, ?> keyParams, TypeReference<T> type, Duration ttl,
                               Callable<T> generator) throws Exception {
        Objects.requireNonNull(type, "type cannot be null");
        return load(prefix, keyParams, mapper.constructType(type), ttl, generator);
    }

    // ========== Non-blocking ==========

    /**
     * Non-blocking variant of {@link #getOrGenerate(String, Map, Class, Callable)} using the
     * default time-to-live.
     */
    public <T> CompletableFuture<T> getOrGenerateAsync(String prefix, Map<String, ?> keyParams, Class<T> type,
                                                       Supplier<? extends CompletionStage<T>> generator) {
        return getOrGenerateAsync(prefix, keyParams, type, null, generator);
    }

    /**
     * Returns a future for the cached value, or for the result of {@code generator} on a miss.
     * Cache reads and writes run on the cache's executor; the generator is called from there and
     * must not block. The returned future completes after the generated value has been written.
     *
     * <p>If the generator's stage fails, the returned future fails with the same cause and nothing
     * is cached.
     *
     * @param prefix the key prefix
     * @param keyParams the parameters identifying the call
     * @param type the type the cached JSON is converted to
     * @param ttl the time-to-live of a generated entry, or {@code null} for the default
     * @param generator starts generation on a miss
     * @param <T> the value type
     * @return a future for the cached or generated value
     * @throws IllegalArgumentException if {@code prefix} is blank or {@code ttl} is not positive;
     *         thrown to the caller before anything is scheduled
     */
    public <T> CompletableFuture<T> getOrGenerateAsync(String prefix, Map<String, ?> keyParams, Class<T> type,
                                                       Duration ttl,
                                                       Supplier<? extends CompletionStage<T>> generator) {
        Objects.requireNonNull(type, "type cannot be null");
        return loadAsync(prefix, keyParams, mapper.constructType(type), ttl, generator);
    }

    /**
     * Generic-type variant of {@link #getOrGenerateAsync(String, Map, Class, Supplier)}.
     */
    public <T> CompletableFuture<T> getOrGenerateAsync(String prefix, Map<String, ?> keyParams,
                                                       TypeReference<T> type,
                                                       Supplier<? extends CompletionStage<T>> generator) {
        return getOrGenerateAsync(prefix, keyParams, type, null, generator);
    }

    /**
     * Generic-type variant of {@link #getOrGenerateAsync(String, Map, Class, Duration, Supplier)}.
     */
    public <T> CompletableFuture<T> getOrGenerateAsync(String prefix, Map<String, ?> keyParams,
                                                       TypeReference<T> type, Duration ttl,
                                                       Supplier<? extends CompletionStage<T>> generator) {
        Objects.requireNonNull(type, "type cannot be null");
        return loadAsync(prefix, keyParams, mapper.constructType(type), ttl, generator);
    }

    // ========== Decorators ==========

    /**
     * Wraps {@code function} so that its results are cached under keys derived from
     * {@code prefix} and the parameters {@code keyExtractor} returns for each argument.
     *
     * @param prefix the key prefix
     * @param type the result type
     * @param ttl the time-to-live of generated entries, or {@code null} for the default
     * @param keyExtractor maps an argument to its key parameters
     * @param function the function to memoize
     * @param <A> the argument type
     * @param <T> the result type
     * @return the memoized function
     * @throws IllegalArgumentException if {@code prefix} is blank or {@code ttl} is not positive
     */
    public <A, T> MemoizedFunction<A, T> memoize(String prefix, Class<T> type, Duration ttl,
                                                 KeyExtractor<A> keyExtractor, GeneratorFunction<A, T> function) {
        Objects.requireNonNull(type, "type cannot be null");
        return memoize(prefix, mapper.constructType(type), ttl, keyExtractor, function);
    }

    /**
     * Generic-type variant of {@link #memoize(String, Class, Duration, KeyExtractor, GeneratorFunction)}.
     */
    public <A, T> MemoizedFunction<A, T> memoize(String prefix, TypeReference<T> type, Duration ttl,
                                                 KeyExtractor<A> keyExtractor, GeneratorFunction<A, T> function) {
        Objects.requireNonNull(type, "type cannot be null");
        return memoize(prefix, mapper.constructType(type), ttl, keyExtractor, function);
    }

    /**
     * Non-blocking variant of {@link #memoize(String, Class, Duration, KeyExtractor, GeneratorFunction)}.
     */
    public <A, T> AsyncMemoizedFunction<A, T> memoizeAsync(String prefix, Class<T> type, Duration ttl,
                                                           KeyExtractor<A> keyExtractor,
                                                           Function<A, ? extends CompletionStage<T>> function) {
        Objects.requireNonNull(type, "type cannot be null");
        return memoizeAsync(prefix, mapper.constructType(type), ttl, keyExtractor, function);
    }

    /**
     * Generic-type variant of {@link #memoizeAsync(String, Class, Duration, KeyExtractor, Function)}.
     */
    public <A, T> AsyncMemoizedFunction<A, T> memoizeAsync(String prefix, TypeReference<T> type, Duration ttl,
                                                           KeyExtractor<A> keyExtractor,
                                                           Function<A, ? extends CompletionStage<T>> function) {
        Objects.requireNonNull(type, "type cannot be null");
        return memoizeAsync(prefix, mapper.constructType(type), ttl, keyExtractor, function);
    }

    /**
     * Returns the asynchronous cache generated values are stored in.
     */
    public AsyncGenerationCache cache() {
        return cache;
    }

    /**
     * Returns the synchronous view of the backing cache.
     */
    public GenerationCache synchronous() {
        return cache.synchronous();
    }

    private <A, T> MemoizedFunction<A, T> memoize(String prefix, JavaType type, Duration ttl,
                                                  KeyExtractor<A> keyExtractor, GeneratorFunction<A, T> function) {
        requirePrefix(prefix);
        requireTtl(ttl);
        Objects.requireNonNull(keyExtractor, "keyExtractor cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
        return argument -> load(prefix, keyExtractor.extract(argument), type, ttl,
                () -> function.apply(argument));
    }

    private <A, T> AsyncMemoizedFunction<A, T> memoizeAsync(String prefix, JavaType type, Duration ttl,
                                                            KeyExtractor<A> keyExtractor,
                                                            Function<A, ? extends CompletionStage<T>> function) {
        requirePrefix(prefix);
        requireTtl(ttl);
        Objects.requireNonNull(keyExtractor, "keyExtractor cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
        return argument -> loadAsync(prefix, keyExtractor.extract(argument), type, ttl,
                () -> function.apply(argument));
    }

    private <T> T load(String prefix, Map<String, ?> keyParams, JavaType type, Duration ttl,
                       Callable<T> generator) throws Exception {
        requireTtl(ttl);
        Objects.requireNonNull(generator, "generator cannot be null");
        String key = deriveKey(prefix, keyParams);
        GenerationCache sync = cache.synchronous();

        T cached = convert(key, sync.get(key), type);
        if (cached != null) {
            return cached;
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Generating value for: " + key);
        }
        long start = System.nanoTime();
        T value;
        try {
            value = generator.call();
        } catch (Exception | Error e) {
            stats.recordGenerationFailure(System.nanoTime() - start);
            throw e;
        }
        long elapsed = System.nanoTime() - start;
        if (value == null) {
            stats.recordGenerationFailure(elapsed);
            throw new NullPointerException("generator returned null for key: " + key);
        }
        stats.recordGenerationSuccess(elapsed);

        JsonNode node = toJson(key, value);
        if (node != null) {
            sync.set(key, node, ttl, metadataFor(keyParams));
        }
        return value;
    }

    private <T> CompletableFuture<T> loadAsync(String prefix, Map<String, ?> keyParams, JavaType type,
                                               Duration ttl, Supplier<? extends CompletionStage<T>> generator) {
        requireTtl(ttl);
        Objects.requireNonNull(generator, "generator cannot be null");
        String key = deriveKey(prefix, keyParams);
        Map<String, JsonNode> metadata = metadataFor(keyParams);

        return cache.get(key).thenCompose(node -> {
            T cached = convert(key, node, type);
            if (cached != null) {
                return CompletableFuture.completedFuture(cached);
            }
            return generateAsync(key, ttl, metadata, generator);
        });
    }

    private <T> CompletableFuture<T> generateAsync(String key, Duration ttl, Map<String, JsonNode> metadata,
                                                   Supplier<? extends CompletionStage<T>> generator) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Generating value for: " + key);
        }
        long start = System.nanoTime();
        CompletionStage<T> stage;
        try {
            stage = generator.get();
        } catch (RuntimeException | Error e) {
            stats.recordGenerationFailure(System.nanoTime() - start);
            return CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            stats.recordGenerationFailure(System.nanoTime() - start);
            return CompletableFuture.failedFuture(
                    new NullPointerException("generator returned a null stage for key: " + key));
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            long elapsed = System.nanoTime() - start;
            if (error != null) {
                stats.recordGenerationFailure(elapsed);
                result.completeExceptionally(unwrap(error));
                return;
            }
            if (value == null) {
                stats.recordGenerationFailure(elapsed);
                result.completeExceptionally(new NullPointerException("generator returned null for key: " + key));
                return;
            }
            stats.recordGenerationSuccess(elapsed);

            JsonNode node = toJson(key, value);
            if (node == null) {
                result.complete(value);
                return;
            }
            cache.set(key, node, ttl, metadata).whenComplete((ignored, writeError) -> {
                if (writeError != null) {
                    LOGGER.log(Level.WARNING, "Failed to cache generated value for: " + key, unwrap(writeError));
                }
                result.complete(value);
            });
        });
        return result;
    }

    private <T> T convert(String key, JsonNode node, JavaType type) {
        if (node == null) {
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.log(Level.WARNING, "Cached value for " + key + " is not a " + type.toCanonical()
                    + ", regenerating", e);
            return null;
        }
    }

    private JsonNode toJson(String key, Object value) {
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.WARNING, "Generated value for " + key + " cannot be stored as JSON, returning it uncached", e);
            return null;
        }
    }

    private Map<String, JsonNode> metadataFor(Map<String, ?> keyParams) {
        return Collections.singletonMap(PARAMS_FIELD, keyDeriver.toParamsNode(keyParams));
    }

    private static void requirePrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
    }

    private static void requireTtl(Duration ttl) {
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
