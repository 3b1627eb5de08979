package com.eventaudit.domain.check;

import com.eventaudit.config.AuditProperties;
import com.eventaudit.domain.model.CheckResult;
import com.eventaudit.domain.model.Dataset;
import com.eventaudit.domain.model.Finding;
import com.eventaudit.domain.model.FreshnessSnapshot;
import com.eventaudit.domain.model.Severity;
import com.eventaudit.domain.service.AuditDatasetService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Ingestion latency: time since the most recent ingested event.
 */
@Slf4j
public class FreshnessCheck implements AuditCheck {

    public static final String NAME = "freshness";

    private final AuditDatasetService datasets;
    private final AuditProperties.Freshness settings;
    private final Clock clock;

    public FreshnessCheck(AuditDatasetService datasets, AuditProperties.Freshness settings, Clock clock) {
        this.datasets = datasets;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run() {
        Dataset<FreshnessSnapshot> data = datasets.freshness();
        FreshnessSnapshot snapshot = data.getValue();
        double budgetMinutes = settings.getLatencyBudget().toMinutes();

        if (snapshot.getLatestEventTime() == null) {
            return new CheckResult(NAME, List.of(Finding.builder()
                    .checkName(NAME)
                    .severity(Severity.CRITICAL)
                    .subject("ingestion")
                    .observed(snapshot.getEventsLastHour())
                    .baseline(budgetMinutes)
                    .detail("No ingested events within the freshness window")
                    .build()), data.getSource());
        }

        Duration delay = Duration.between(snapshot.getLatestEventTime(), clock.instant());
        double delayMinutes = delay.toSeconds() / 60.0;
        log.info("Latest event ingested {} minutes ago", String.format("%.1f", delayMinutes));

        Severity severity = null;
        if (delay.compareTo(settings.getLatencyBudget()) > 0) {
            severity = Severity.CRITICAL;
        } else if (delay.compareTo(settings.getWarningBudget()) > 0) {
            severity = Severity.WARNING;
        }
        if (severity == null) {
            return new CheckResult(NAME, List.of(), data.getSource());
        }

        return new CheckResult(NAME, List.of(Finding.builder()
                .checkName(NAME)
                .severity(severity)
                .subject("ingestion")
                .observed(delayMinutes)
                .baseline(budgetMinutes)
                .detail(String.format("Latest event at %s, %.0f minutes ago (budget %.0f)",
                        snapshot.getLatestEventTime(), delayMinutes, budgetMinutes))
                .build()), data.getSource());
    }
}
