package com.github.rudygunawan.gencache.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.rudygunawan.gencache.policy.ExpirationPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A cached value together with its expiration and bookkeeping metadata.
 *
 * <p>Instances are immutable. The value tree is copied on construction and on every read so that
 * callers cannot mutate an entry that is shared between the memory tier and other readers. Writing
 * the same key again replaces the entry; entries are never updated in place.
 */
public final class CacheEntry {

    private final JsonNode value;
    private final long expiresAtMillis;
    private final long createdAtMillis;
    private final String cacheKey;
    private final Map<String, JsonNode> metadata;

    /**
     * Creates a new cache entry.
     *
     * @param cacheKey the key the entry is stored under
     * @param value the cached payload
     * @param expiresAtMillis absolute expiration time, epoch milliseconds
     * @param createdAtMillis creation time, epoch milliseconds
     * @param metadata caller supplied metadata, may be empty
     */
    public CacheEntry(String cacheKey, JsonNode value, long expiresAtMillis, long createdAtMillis,
                      Map<String, JsonNode> metadata) {
        this.cacheKey = Objects.requireNonNull(cacheKey, "cacheKey cannot be null");
        this.value = Objects.requireNonNull(value, "value cannot be null").deepCopy();
        this.expiresAtMillis = expiresAtMillis;
        this.createdAtMillis = createdAtMillis;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Returns a copy of the cached value.
     */
    public JsonNode getValue() {
        return value.deepCopy();
    }

    /**
     * Returns the absolute expiration time in epoch milliseconds.
     */
    public long getExpiresAtMillis() {
        return expiresAtMillis;
    }

    /**
     * Returns the creation time in epoch milliseconds.
     */
    public long getCreatedAtMillis() {
        return createdAtMillis;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    /**
     * Returns the unmodifiable metadata map.
     */
    public Map<String, JsonNode> getMetadata() {
        return metadata;
    }

    /**
     * Returns true if this entry has expired at {@code nowMillis}.
     */
    public boolean isExpiredAt(long nowMillis) {
        return ExpirationPolicy.isExpired(expiresAtMillis, nowMillis);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheEntry)) {
            return false;
        }
        CacheEntry other = (CacheEntry) obj;
        return expiresAtMillis == other.expiresAtMillis
                && createdAtMillis == other.createdAtMillis
                && cacheKey.equals(other.cacheKey)
                && value.equals(other.value)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cacheKey, value, expiresAtMillis, createdAtMillis, metadata);
    }

    @Override
    public String toString() {
        return "CacheEntry{"
                + "cacheKey=" + cacheKey
                + ", expiresAtMillis=" + expiresAtMillis
                + ", createdAtMillis=" + createdAtMillis
                + ", metadata=" + metadata.keySet()
                + '}';
    }
}
