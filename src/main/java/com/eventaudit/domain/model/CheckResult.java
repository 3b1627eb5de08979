package com.eventaudit.domain.model;

import com.eventaudit.infrastructure.cache.CacheSource;
import lombok.Value;

import java.util.List;

/**
 * Findings from one successful check run, with the provenance of its dataset.
 */
@Value
public class CheckResult {
    String checkName;
    List<Finding> findings;
    CacheSource cacheSource;

    public CheckResult(String checkName, List<Finding> findings, CacheSource cacheSource) {
        this.checkName = checkName;
        this.findings = List.copyOf(findings);
        this.cacheSource = cacheSource;
    }
}
