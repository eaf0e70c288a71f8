package com.dataPlatform.platformFacade.facade.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Process-wide cache of normalized platform responses.
 *
 * Freshness is decided by the reader: {@link #get(String, Duration)} takes the TTL,
 * so the same entry can be fresh for one caller and stale for another.
 * Expired entries are removed lazily, on the read that finds them stale. There is
 * no background eviction, so {@link #size()} includes expired entries nobody has
 * read yet.
 *
 * One instance is created at startup by {@code FacadeConfig} and injected into every
 * facade service. All access is serialized on the instance monitor; the cache does no
 * I/O while holding it.
 */
@Slf4j
public class ResponseCache {

    /**
     * Unbounded store with no expiry policy: entries leave only through
     * {@link #get} or {@link #clear}.
     */
    private final Cache<String, CacheEntry> store = Caffeine.newBuilder().build();

    private final Clock clock;

    private long hits;
    private long misses;
    private long expirations;

    public ResponseCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the cached value if present and not older than {@code ttl}.
     * A stale entry is removed.
     *
     * @param key Cache key
     * @param ttl Maximum accepted age (must not be negative)
     * @return Cached value, or empty on miss or expiry
     */
    public synchronized Optional<Object> get(String key, Duration ttl) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive");
        }

        CacheEntry entry = store.getIfPresent(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }

        if (!entry.isFresh(clock.instant(), ttl)) {
            store.invalidate(key);
            expirations++;
            misses++;
            log.debug("Cache entry expired - key: {}, storedAt: {}, ttl: {}", key, entry.storedAt(), ttl);
            return Optional.empty();
        }

        hits++;
        return Optional.ofNullable(entry.value());
    }

    /**
     * Stores or overwrites a value, stamped with the current time.
     */
    public synchronized void set(String key, Object value) {
        Instant now = clock.instant();
        store.put(key, new CacheEntry(key, value, now));
    }

    /**
     * Removes all entries. Statistics are kept.
     *
     * @return Number of entries removed
     */
    public synchronized int clear() {
        int removed = size();
        store.invalidateAll();
        log.info("Cache cleared - entries removed: {}", removed);
        return removed;
    }

    /**
     * Number of stored entries, including expired ones not yet read.
     */
    public synchronized int size() {
        return Math.toIntExact(store.estimatedSize());
    }

    /**
     * Snapshot of size and hit/miss counters.
     * Useful for monitoring.
     */
    public synchronized CacheStatistics statistics() {
        return new CacheStatistics(size(), hits, misses, expirations);
    }

    public record CacheStatistics(int size, long hits, long misses, long expirations) {
    }
}
