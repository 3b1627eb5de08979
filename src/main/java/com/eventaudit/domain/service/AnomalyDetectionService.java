package com.eventaudit.domain.service;

import com.eventaudit.config.AuditProperties;
import com.eventaudit.domain.check.AuditCheck;
import com.eventaudit.domain.exception.BackendUnavailableException;
import com.eventaudit.domain.exception.ConfigurationMissingException;
import com.eventaudit.domain.exception.InsufficientDataException;
import com.eventaudit.domain.exception.UnknownCheckException;
import com.eventaudit.domain.model.AuditReport;
import com.eventaudit.domain.model.CheckFailure;
import com.eventaudit.domain.model.CheckResult;
import com.eventaudit.domain.model.Finding;
import com.eventaudit.domain.model.Severity;
import com.eventaudit.infrastructure.cache.CacheSource;
import com.eventaudit.infrastructure.cache.CacheStats;
import com.eventaudit.infrastructure.cache.TieredCache;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs the configured checks and assembles the audit report.
 *
 * Failure Handling:
 * - Each check runs in isolation; one failure never aborts the others
 * - Backend failures are retried per check, then recorded as a failure
 * - Missing configuration is recorded as a failure and never retried
 * - Insufficient history is reported as an info finding
 *
 * Checks run concurrently on the check executor. Two checks that need the
 * same dataset share one backend query through the cache.
 */
@Slf4j
public class AnomalyDetectionService {

    private static final int CRITICAL_PENALTY = 20;
    private static final int WARNING_PENALTY = 10;

    private final Map<String, AuditCheck> checks;
    private final TieredCache cache;
    private final Executor checkExecutor;
    private final RetryConfig retryConfig;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public AnomalyDetectionService(List<AuditCheck> checks,
                                   TieredCache cache,
                                   Executor checkExecutor,
                                   AuditProperties.Checks settings,
                                   MeterRegistry meterRegistry,
                                   Clock clock) {
        Map<String, AuditCheck> byName = new LinkedHashMap<>();
        for (AuditCheck check : checks) {
            if (byName.putIfAbsent(check.name(), check) != null) {
                throw new IllegalArgumentException("Duplicate check name: " + check.name());
            }
        }
        this.checks = byName;
        this.cache = cache;
        this.checkExecutor = checkExecutor;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .waitDuration(settings.getRetryWait())
                .retryExceptions(BackendUnavailableException.class)
                .ignoreExceptions(ConfigurationMissingException.class, InsufficientDataException.class)
                .build();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Run every check. Partial results are returned when some checks fail.
     */
    public AuditReport runAllChecks() {
        log.info("Running {} audit checks", checks.size());

        List<CompletableFuture<CheckOutcome>> pending = new ArrayList<>();
        for (AuditCheck check : checks.values()) {
            pending.add(CompletableFuture.supplyAsync(() -> runIsolated(check), checkExecutor));
        }

        List<CheckOutcome> outcomes = new ArrayList<>(pending.size());
        for (CompletableFuture<CheckOutcome> future : pending) {
            outcomes.add(future.join());
        }
        return buildReport(outcomes);
    }

    /**
     * Re-run a single check by name.
     *
     * @throws UnknownCheckException if no check has that name
     */
    public AuditReport runCheck(String name) {
        AuditCheck check = checks.get(name);
        if (check == null) {
            throw new UnknownCheckException("Unknown check: " + name);
        }
        return buildReport(List.of(runIsolated(check)));
    }

    public List<String> checkNames() {
        return List.copyOf(checks.keySet());
    }

    /**
     * @return number of entries removed from both cache tiers
     */
    public int clearCache() {
        return cache.clear();
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    private CheckOutcome runIsolated(AuditCheck check) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Retry retry = Retry.of("check-" + check.name(), retryConfig);
        try {
            CheckResult result = Retry.decorateSupplier(retry, check::run).get();
            record(check, sample, "success");
            log.info("Check {} produced {} findings ({})",
                    check.name(), result.getFindings().size(), result.getCacheSource());
            return CheckOutcome.success(result);

        } catch (InsufficientDataException e) {
            record(check, sample, "skipped");
            log.info("Check {} skipped: {}", check.name(), e.getMessage());
            Finding skipped = Finding.builder()
                    .checkName(check.name())
                    .severity(Severity.INFO)
                    .subject(check.name())
                    .detail("Insufficient data: " + e.getMessage())
                    .build();
            return CheckOutcome.success(new CheckResult(check.name(), List.of(skipped), null));

        } catch (ConfigurationMissingException e) {
            record(check, sample, "misconfigured");
            log.error("Check {} is misconfigured: {}", check.name(), e.getMessage());
            return CheckOutcome.failure(new CheckFailure(check.name(), "Configuration missing: " + e.getMessage()));

        } catch (RuntimeException e) {
            record(check, sample, "error");
            log.error("Check {} failed: {}", check.name(), e.getMessage(), e);
            return CheckOutcome.failure(new CheckFailure(check.name(), e.getMessage()));
        }
    }

    private void record(AuditCheck check, Timer.Sample sample, String result) {
        sample.stop(Timer.builder("audit.check.latency")
                .tag("check", check.name())
                .register(meterRegistry));
        Counter.builder("audit.check.executed")
                .tag("check", check.name())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private AuditReport buildReport(List<CheckOutcome> outcomes) {
        AuditReport.AuditReportBuilder report = AuditReport.builder().generatedAt(clock.instant());
        Map<String, List<Finding>> criticalIssues = new LinkedHashMap<>();
        int critical = 0;
        int warning = 0;
        int sources = 0;
        int cached = 0;

        for (CheckOutcome outcome : outcomes) {
            if (outcome.failure() != null) {
                report.failure(outcome.failure());
                continue;
            }
            CheckResult result = outcome.result();
            for (Finding finding : result.getFindings()) {
                report.finding(finding);
                if (finding.getSeverity() == Severity.CRITICAL) {
                    critical++;
                    criticalIssues.computeIfAbsent(finding.getCheckName(), k -> new ArrayList<>()).add(finding);
                } else if (finding.getSeverity() == Severity.WARNING) {
                    warning++;
                }
            }
            if (result.getCacheSource() != null) {
                report.cacheSource(result.getCheckName(), result.getCacheSource());
                sources++;
                if (result.getCacheSource() != CacheSource.QUERY) {
                    cached++;
                }
            }
        }

        int score = 100 - critical * CRITICAL_PENALTY - warning * WARNING_PENALTY;
        return report
                .healthScore(Math.max(0, Math.min(100, score)))
                .criticalIssues(criticalIssues)
                .cacheHitRate(sources == 0 ? 0.0 : (double) cached / sources)
                .build();
    }

    private record CheckOutcome(CheckResult result, CheckFailure failure) {

        static CheckOutcome success(CheckResult result) {
            return new CheckOutcome(result, null);
        }

        static CheckOutcome failure(CheckFailure failure) {
            return new CheckOutcome(null, failure);
        }
    }
}
