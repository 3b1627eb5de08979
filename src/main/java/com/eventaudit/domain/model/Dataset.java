package com.eventaudit.domain.model;

import com.eventaudit.infrastructure.cache.CacheSource;
import lombok.Value;

/**
 * A dataset pulled through the cache, tagged with where it came from.
 */
@Value
public class Dataset<T> {
    T value;
    CacheSource source;
}
