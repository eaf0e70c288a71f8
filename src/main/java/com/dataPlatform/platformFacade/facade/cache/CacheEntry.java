package com.dataPlatform.platformFacade.facade.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value and the moment it was stored.
 */
public record CacheEntry(String key, Object value, Instant storedAt) {

    /**
     * An entry is fresh while its age does not exceed the reader's TTL.
     */
    boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(storedAt, now).compareTo(ttl) <= 0;
    }
}
