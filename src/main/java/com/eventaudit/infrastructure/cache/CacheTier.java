package com.eventaudit.infrastructure.cache;

public enum CacheTier {
    MEMORY,
    PERSISTED
}
