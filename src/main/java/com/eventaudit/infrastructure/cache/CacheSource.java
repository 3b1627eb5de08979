package com.eventaudit.infrastructure.cache;

/**
 * Where a cache lookup obtained its value.
 */
public enum CacheSource {
    MEMORY,
    PERSISTED,
    QUERY
}
