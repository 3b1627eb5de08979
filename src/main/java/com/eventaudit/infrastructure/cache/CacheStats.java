package com.eventaudit.infrastructure.cache;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {
    int memoryEntries;
    int persistedEntries;
    long memoryHits;
    long persistedHits;
    long misses;
    long supplierInvocations;
    long corruptArtifacts;
}
