package com.github.rudygunawan.gencache.builder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.rudygunawan.gencache.api.AsyncGenerationCache;
import com.github.rudygunawan.gencache.api.GenerationCache;
import com.github.rudygunawan.gencache.impl.AsyncGenerationCacheImpl;
import com.github.rudygunawan.gencache.impl.TieredGenerationCache;
import com.github.rudygunawan.gencache.memo.MemoizingCache;
import com.github.rudygunawan.gencache.metrics.StatsCollector;
import com.github.rudygunawan.gencache.time.TimeSource;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A builder of {@link GenerationCache}, {@link AsyncGenerationCache} and {@link MemoizingCache}
 * instances. Configuration is supplied once, here; caches never read the environment on their own.
 *
 * <p>Usage example:
 * <pre>{@code
 * MemoizingCache cache = CacheBuilder.newBuilder()
 *     .cacheDirectory(Paths.get("/var/cache/worksheets"))
 *     .defaultTtl(7, TimeUnit.DAYS)
 *     .maximumMemoryEntries(1000)
 *     .buildMemoizing();
 *
 * String intro = cache.getOrGenerate("intro_page",
 *     Map.of("subject", "math", "topic", "fractions"),
 *     String.class,
 *     () -> llm.generateIntro("math", "fractions"));
 * }</pre>
 *
 * <p>Hosts construct one cache and pass it to the components that need it. To start over, for
 * example between tests, build a new instance.
 */
public class CacheBuilder {

    /** Environment variable naming the cache root directory. */
    public static final String ENV_CACHE_DIR = "CACHE_DIR";
    /** Environment variable holding the default time-to-live in days. */
    public static final String ENV_TTL_DAYS = "LLM_CACHE_TTL_DAYS";
    /** Environment variable holding the memory tier bound. */
    public static final String ENV_MAX_MEMORY_ENTRIES = "CACHE_MAX_MEMORY_ENTRIES";

    static final String DEFAULT_DIRECTORY_NAME = "homebook_cache";
    static final long DEFAULT_TTL_DAYS = 7;
    static final int DEFAULT_MAXIMUM_MEMORY_ENTRIES = 1000;

    private Path cacheDirectory = Paths.get(System.getProperty("java.io.tmpdir"), DEFAULT_DIRECTORY_NAME);
    private Duration defaultTtl = Duration.ofDays(DEFAULT_TTL_DAYS);
    private int maximumMemoryEntries = DEFAULT_MAXIMUM_MEMORY_ENTRIES;
    private TimeSource timeSource = TimeSource.systemTimeSource();
    private ObjectMapper objectMapper;
    private Executor executor;

    private CacheBuilder() {
    }

    /**
     * Constructs a new {@code CacheBuilder} instance with default settings.
     */
    public static CacheBuilder newBuilder() {
        return new CacheBuilder();
    }

    /**
     * Constructs a builder configured from the process environment.
     *
     * @see #fromEnvironment(Map)
     */
    public static CacheBuilder fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Constructs a builder configured from {@code env}. Recognized variables:
     * <ul>
     *   <li>{@value #ENV_CACHE_DIR}: cache root directory, default {@code {java.io.tmpdir}/homebook_cache}</li>
     *   <li>{@value #ENV_TTL_DAYS}: default time-to-live in days, default 7</li>
     *   <li>{@value #ENV_MAX_MEMORY_ENTRIES}: memory tier bound, default 1000</li>
     * </ul>
     * Unset or blank variables keep their default.
     *
     * @param env the environment to read
     * @return a new builder
     * @throws IllegalArgumentException if a numeric variable is not a valid positive number
     */
    public static CacheBuilder fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env cannot be null");
        CacheBuilder builder = newBuilder();
        String dir = env.get(ENV_CACHE_DIR);
        if (dir != null && !dir.isBlank()) {
            builder.cacheDirectory(Paths.get(dir.trim()));
        }
        String ttlDays = env.get(ENV_TTL_DAYS);
        if (ttlDays != null && !ttlDays.isBlank()) {
            builder.defaultTtl(parsePositiveLong(ENV_TTL_DAYS, ttlDays), TimeUnit.DAYS);
        }
        String maxEntries = env.get(ENV_MAX_MEMORY_ENTRIES);
        if (maxEntries != null && !maxEntries.isBlank()) {
            long max = parsePositiveLong(ENV_MAX_MEMORY_ENTRIES, maxEntries);
            if (max > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(ENV_MAX_MEMORY_ENTRIES + " is too large: " + maxEntries);
            }
            builder.maximumMemoryEntries((int) max);
        }
        return builder;
    }

    /**
     * Sets the root directory of the file tier. The directory is created if needed; if it cannot
     * be created the cache runs memory-only.
     *
     * @param cacheDirectory the directory
     * @return this builder instance
     */
    public CacheBuilder cacheDirectory(Path cacheDirectory) {
        this.cacheDirectory = Objects.requireNonNull(cacheDirectory, "cacheDirectory cannot be null");
        return this;
    }

    /**
     * Sets the time-to-live applied by {@code set} and {@code getOrGenerate} calls that do not
     * specify one.
     *
     * <p>This option is not required; by default entries live for 7 days.
     *
     * @param ttl the default time-to-live
     * @return this builder instance
     * @throws IllegalArgumentException if {@code ttl} is zero or negative
     */
    public CacheBuilder defaultTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("default ttl must be positive");
        }
        this.defaultTtl = ttl;
        return this;
    }

    /**
     * Sets the default time-to-live.
     *
     * @param duration the length of time
     * @param unit the unit of {@code duration}
     * @return this builder instance
     * @throws IllegalArgumentException if {@code duration} is zero or negative
     */
    public CacheBuilder defaultTtl(long duration, TimeUnit unit) {
        Objects.requireNonNull(unit, "unit cannot be null");
        if (duration <= 0) {
            throw new IllegalArgumentException("default ttl must be positive");
        }
        return defaultTtl(Duration.of(duration, unit.toChronoUnit()));
    }

    /**
     * Specifies the maximum number of entries the memory tier may hold. When a new key is written
     * to a full memory tier, the least recently used entry is evicted first. The file tier is not
     * bounded.
     *
     * <p>This option is not required; by default the memory tier holds 1000 entries.
     *
     * @param maximumMemoryEntries the maximum number of in-memory entries
     * @return this builder instance
     * @throws IllegalArgumentException if {@code maximumMemoryEntries} is not positive
     */
    public CacheBuilder maximumMemoryEntries(int maximumMemoryEntries) {
        if (maximumMemoryEntries <= 0) {
            throw new IllegalArgumentException("maximum memory entries must be positive");
        }
        this.maximumMemoryEntries = maximumMemoryEntries;
        return this;
    }

    /**
     * Specifies the time source used for expiration. Mainly useful in tests.
     *
     * @param timeSource the time source
     * @return this builder instance
     */
    public CacheBuilder timeSource(TimeSource timeSource) {
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource cannot be null");
        return this;
    }

    /**
     * Specifies the Jackson mapper used to read and write entry files, to convert generated values
     * to JSON and to serialize key parameters.
     *
     * <p>This option is not required; by default a mapper with {@link JavaTimeModule} registered
     * and ISO-8601 date output is used.
     *
     * @param objectMapper the mapper
     * @return this builder instance
     */
    public CacheBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        return this;
    }

    /**
     * Specifies the executor that asynchronous caches run tier operations on.
     *
     * <p>This option is not required; by default this builder creates one cached pool of daemon
     * threads named {@code gencache-io-N} and shares it between every cache it builds. Idle
     * threads exit after a minute, so the pool needs no shutdown. A caller-supplied executor is
     * never shut down by the cache either.
     *
     * @param executor the executor
     * @return this builder instance
     */
    public CacheBuilder executor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        return this;
    }

    /**
     * Builds a synchronous cache.
     *
     * @return a new cache
     */
    public GenerationCache build() {
        return new TieredGenerationCache(this, new StatsCollector());
    }

    /**
     * Builds a non-blocking cache that runs tier operations on the configured executor.
     *
     * @return a new asynchronous cache
     */
    public AsyncGenerationCache buildAsync() {
        return new AsyncGenerationCacheImpl(build(), getExecutor());
    }

    /**
     * Builds a memoizing cache offering blocking and non-blocking get-or-generate calls.
     *
     * @return a new memoizing cache
     */
    public MemoizingCache buildMemoizing() {
        StatsCollector stats = new StatsCollector();
        TieredGenerationCache cache = new TieredGenerationCache(this, stats);
        return new MemoizingCache(new AsyncGenerationCacheImpl(cache, getExecutor()), getObjectMapper(), stats);
    }

    public Path getCacheDirectory() {
        return cacheDirectory;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public int getMaximumMemoryEntries() {
        return maximumMemoryEntries;
    }

    public TimeSource getTimeSource() {
        return timeSource;
    }

    /**
     * Returns the configured mapper, creating the default one on first use.
     */
    public ObjectMapper getObjectMapper() {
        if (objectMapper == null) {
            objectMapper = new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        }
        return objectMapper;
    }

    /**
     * Returns the configured executor, creating this builder's default pool on first use.
     */
    public Executor getExecutor() {
        if (executor == null) {
            executor = createDefaultExecutor();
        }
        return executor;
    }

    private static ExecutorService createDefaultExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "gencache-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static long parsePositiveLong(String name, String raw) {
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + raw, e);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + raw);
        }
        return value;
    }
}
