package com.williamcallahan.dictionary_engine.service.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached value with its write time and time-to-live.
 *
 * @param key storage key ({@link CacheKey#asStorageKey()})
 * @param value cached value
 * @param writtenAt first write; enrichment keeps it unchanged
 * @param ttl lifetime measured from writtenAt
 * @param partial true while a remote generation is still filling the value; never persisted
 */
public record CacheEntry<V>(String key, V value, Instant writtenAt, Duration ttl, boolean partial) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(writtenAt.plus(ttl));
    }

    public CacheEntry<V> withValue(V newValue) {
        return new CacheEntry<>(key, newValue, writtenAt, ttl, partial);
    }
}
