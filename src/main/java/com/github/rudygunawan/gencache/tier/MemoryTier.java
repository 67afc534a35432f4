package com.github.rudygunawan.gencache.tier;

import com.github.rudygunawan.gencache.model.CacheEntry;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded in-process store with least-recently-used eviction.
 *
 * <p>Entries live in one {@link LinkedHashMap} whose iteration order is the recency order, so the
 * map and the recency order can never disagree. A touch moves an entry to the tail by removing and
 * re-inserting it; {@link #peek(String)} reads without moving anything. Among entries that have not
 * been touched since they were written, the oldest insertion is evicted first. Every single-key
 * operation is O(1).
 *
 * <p>When a new key is written while the tier is full, the least recently used entry is evicted
 * before the insert, so the size never exceeds the maximum, not even transiently. Replacing an
 * existing key does not evict anything.
 *
 * <p>All operations hold one {@link ReentrantLock}. This tier does not look at expiry on its own;
 * callers decide what is expired and purge it with {@link #remove(String, CacheEntry)}.
 */
public final class MemoryTier {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.gencache.Cache");

    private final int maximumEntries;
    private final LinkedHashMap<String, CacheEntry> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private final Consumer<String> evictionListener;

    /**
     * Creates a memory tier holding at most {@code maximumEntries} entries.
     *
     * @param maximumEntries the size bound, must be positive
     * @param evictionListener notified with the key of every evicted entry, while the lock is held
     */
    public MemoryTier(int maximumEntries, Consumer<String> evictionListener) {
        if (maximumEntries <= 0) {
            throw new IllegalArgumentException("maximum entries must be positive");
        }
        this.maximumEntries = maximumEntries;
        this.evictionListener = Objects.requireNonNull(evictionListener, "evictionListener cannot be null");
        this.entries = new LinkedHashMap<>();
    }

    /**
     * Returns the entry for {@code key} and marks it most recently used, or null.
     */
    public CacheEntry get(String key) {
        lock.lock();
        try {
            CacheEntry entry = entries.remove(key);
            if (entry != null) {
                entries.put(key, entry);
            }
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the entry for {@code key} without changing its recency, or null.
     */
    public CacheEntry peek(String key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores {@code entry} under its cache key and marks it most recently used.
     */
    public void put(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry cannot be null");
        String key = entry.getCacheKey();
        lock.lock();
        try {
            if (entries.remove(key) == null) {
                while (entries.size() >= maximumEntries) {
                    evictEldest();
                }
            }
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores {@code entry} unless a live entry for the same key is already present.
     *
     * <p>An existing entry expired at {@code nowMillis} is replaced. Used to promote entries read
     * from disk without overwriting a newer value written concurrently.
     *
     * @return the existing live entry, or null if {@code entry} was stored
     */
    public CacheEntry putIfAbsent(CacheEntry entry, long nowMillis) {
        Objects.requireNonNull(entry, "entry cannot be null");
        String key = entry.getCacheKey();
        lock.lock();
        try {
            CacheEntry existing = entries.get(key);
            if (existing != null && !existing.isExpiredAt(nowMillis)) {
                return existing;
            }
            if (existing == null) {
                while (entries.size() >= maximumEntries) {
                    evictEldest();
                }
            } else {
                entries.remove(key);
            }
            entries.put(key, entry);
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes {@code key}.
     *
     * @return true if an entry was removed
     */
    public boolean remove(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes {@code key} only while it still maps to {@code expected}. Used to purge a stale entry
     * without discarding a newer one written concurrently.
     *
     * @return true if the entry was removed
     */
    public boolean remove(String key, CacheEntry expected) {
        lock.lock();
        try {
            return entries.remove(key, expected);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry whose key starts with {@code keyPrefix}.
     *
     * @return the number of entries removed
     */
    public int removeByPrefix(String keyPrefix) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<String> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().startsWith(keyPrefix)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry expired at {@code nowMillis}.
     *
     * @return the number of entries removed
     */
    public int removeExpired(long nowMillis) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpiredAt(nowMillis)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry.
     *
     * @return the number of entries removed
     */
    public int clear() {
        lock.lock();
        try {
            int size = entries.size();
            entries.clear();
            return size;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int maximumEntries() {
        return maximumEntries;
    }

    /**
     * Returns a snapshot of the keys, least recently used first.
     */
    public List<String> keys() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    private void evictEldest() {
        Iterator<String> it = entries.keySet().iterator();
        String eldest = it.next();
        it.remove();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Evicted memory entry due to size limit: key=" + eldest);
        }
        evictionListener.accept(eldest);
    }
}
