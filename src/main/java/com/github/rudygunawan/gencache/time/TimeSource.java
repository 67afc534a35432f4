package com.github.rudygunawan.gencache.time;

/**
 * A source of wall-clock time in milliseconds since the Unix epoch.
 *
 * <p>Expiration timestamps are persisted to disk and compared across process restarts, so unlike a
 * monotonic ticker this source must be related to wall-clock time. The primary purpose of this
 * interface is to facilitate testing of expiration without relying on the system clock.
 *
 * <p><b>Testing Usage:</b>
 * <pre>{@code
 * FakeTimeSource time = new FakeTimeSource();
 *
 * GenerationCache cache = CacheBuilder.newBuilder()
 *     .cacheDirectory(dir)
 *     .timeSource(time)
 *     .build();
 *
 * cache.set("intro_page_1", TextNode.valueOf("..."), Duration.ofHours(1));
 * time.advance(2, TimeUnit.HOURS);
 * assertNull(cache.get("intro_page_1"));
 * }</pre>
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * Returns the current time in milliseconds since the Unix epoch.
     *
     * @return the current epoch time in milliseconds
     */
    long currentTimeMillis();

    /**
     * Returns a time source that reads {@link System#currentTimeMillis()}.
     *
     * <p>This is the default time source used by caches when none is specified.
     *
     * @return the system time source
     */
    static TimeSource systemTimeSource() {
        return SystemTimeSource.INSTANCE;
    }

    /**
     * Default implementation backed by {@link System#currentTimeMillis()}.
     */
    enum SystemTimeSource implements TimeSource {
        INSTANCE;

        @Override
        public long currentTimeMillis() {
            return System.currentTimeMillis();
        }

        @Override
        public String toString() {
            return "TimeSource.systemTimeSource()";
        }
    }
}
