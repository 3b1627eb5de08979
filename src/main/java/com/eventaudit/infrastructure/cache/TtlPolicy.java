package com.eventaudit.infrastructure.cache;

import com.eventaudit.domain.exception.ConfigurationMissingException;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query class to TTL mapping, fixed at construction.
 *
 * There is no default TTL: an unknown class is a configuration error.
 */
public class TtlPolicy {

    private final Map<String, Duration> ttlByClass;

    public TtlPolicy(Map<String, Duration> ttlByClass) {
        Map<String, Duration> copy = new LinkedHashMap<>();
        ttlByClass.forEach((queryClass, ttl) -> {
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("TTL for query class '" + queryClass + "' must be positive");
            }
            copy.put(queryClass, ttl);
        });
        this.ttlByClass = Collections.unmodifiableMap(copy);
    }

    public Duration ttlFor(String queryClass) {
        Duration ttl = ttlByClass.get(queryClass);
        if (ttl == null) {
            throw new ConfigurationMissingException("No TTL configured for query class: " + queryClass);
        }
        return ttl;
    }

    public Map<String, Duration> asMap() {
        return ttlByClass;
    }
}
