package com.eventaudit.infrastructure.cache;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached value in one tier. Freshness depends on elapsed time only.
 */
@Value
public class CacheEntry {

    CacheKey key;
    Object value;
    Instant createdAt;
    Duration ttl;
    CacheTier tier;

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(createdAt, now).compareTo(ttl) < 0;
    }

    public CacheEntry inTier(CacheTier target) {
        return new CacheEntry(key, value, createdAt, ttl, target);
    }
}
