package com.eventaudit.infrastructure.cache;

import lombok.Value;

import java.time.Instant;

/**
 * Value returned by the cache together with its provenance.
 */
@Value
public class CacheLookup<T> {
    T value;
    CacheSource source;
    Instant createdAt;
}
