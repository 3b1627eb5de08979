package com.eventaudit.domain.model;

import com.eventaudit.infrastructure.cache.CacheSource;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate result of a detection run: findings from every check that
 * succeeded, plus the checks that failed and why.
 */
@Value
@Builder
public class AuditReport {

    Instant generatedAt;

    @Singular
    List<Finding> findings;

    @Singular
    List<CheckFailure> failures;

    /** 0..100; 100 minus 20 per critical and 10 per warning finding. */
    int healthScore;

    @Singular
    Map<String, CacheSource> cacheSources;

    /** Critical findings keyed by the check name they carry, in report order. */
    Map<String, List<Finding>> criticalIssues;

    /** Share of cache sources that were not a fresh query; 0 when there are none. */
    double cacheHitRate;

    public long count(Severity severity) {
        return findings.stream().filter(f -> f.getSeverity() == severity).count();
    }
}
