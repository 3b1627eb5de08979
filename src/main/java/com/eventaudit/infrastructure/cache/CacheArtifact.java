package com.eventaudit.infrastructure.cache;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * On-disk form of a persisted cache entry.
 *
 * {@code key} carries the full encoded key so that a digest collision
 * reads as a miss instead of returning another key's payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheArtifact {

    private String key;
    private String ttlClass;
    private Instant createdAt;
    private long ttlSeconds;
    private JsonNode payload;
}
