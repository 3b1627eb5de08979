package com.eventaudit.domain.check;

import com.eventaudit.config.AuditProperties;
import com.eventaudit.domain.exception.InsufficientDataException;
import com.eventaudit.domain.model.CheckResult;
import com.eventaudit.domain.model.Dataset;
import com.eventaudit.domain.model.EventSeries;
import com.eventaudit.domain.model.Finding;
import com.eventaudit.domain.model.Severity;
import com.eventaudit.domain.model.TimeSeriesPoint;
import com.eventaudit.domain.service.AuditDatasetService;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags days whose event count exceeds {@code mean + k * stddev} of the
 * trailing baseline window.
 *
 * Baseline: the {@code baselineWindowDays} calendar days before the
 * evaluated day, whichever of them have data. Days with fewer than
 * {@code minBaselinePoints} baseline points are skipped. A constant
 * baseline (stddev 0, up to floating point noise) flags any deviation.
 */
@Slf4j
public class SpikeCheck implements AuditCheck {

    public static final String NAME = "daily_spike";

    private static final double CONSTANT_TOLERANCE = 1e-9;

    private final AuditDatasetService datasets;
    private final AuditProperties.Spike settings;

    public SpikeCheck(AuditDatasetService datasets, AuditProperties.Spike settings) {
        this.datasets = datasets;
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run() {
        Dataset<EventSeries> data = datasets.dailyEventCounts(settings.getLookbackDays());
        List<Finding> findings = new ArrayList<>();
        int evaluated = 0;

        for (Map.Entry<String, List<TimeSeriesPoint>> series : data.getValue().byEvent().entrySet()) {
            List<TimeSeriesPoint> points = series.getValue();
            for (TimeSeriesPoint point : points) {
                List<Double> baseline = baselineFor(points, point.getDate());
                if (baseline.size() < settings.getMinBaselinePoints()) {
                    continue;
                }
                evaluated++;
                evaluate(point, baseline).ifPresent(findings::add);
            }
        }

        if (evaluated == 0) {
            throw new InsufficientDataException("No day has " + settings.getMinBaselinePoints()
                    + " baseline points within " + settings.getBaselineWindowDays() + " days");
        }
        log.info("Spike check evaluated {} days, {} spikes", evaluated, findings.size());
        return new CheckResult(NAME, findings, data.getSource());
    }

    private List<Double> baselineFor(List<TimeSeriesPoint> points, LocalDate day) {
        LocalDate windowStart = day.minusDays(settings.getBaselineWindowDays());
        List<Double> baseline = new ArrayList<>();
        for (TimeSeriesPoint p : points) {
            if (!p.getDate().isBefore(windowStart) && p.getDate().isBefore(day)) {
                baseline.add(p.getMetricValue());
            }
        }
        return baseline;
    }

    private Optional<Finding> evaluate(TimeSeriesPoint point, List<Double> baseline) {
        double mean = SeriesStatistics.mean(baseline);
        double stddev = SeriesStatistics.stddev(baseline);
        double observed = point.getMetricValue();
        // rounding noise from summing equal values is not spread
        double tolerance = CONSTANT_TOLERANCE * Math.max(1.0, Math.abs(mean));

        if (stddev <= tolerance) {
            if (Math.abs(observed - mean) <= tolerance) {
                return Optional.empty();
            }
            return Optional.of(Finding.builder()
                    .checkName(NAME)
                    .severity(Severity.WARNING)
                    .subject(point.getEventName())
                    .observed(observed)
                    .baseline(mean)
                    .detail(String.format("%s: %.0f against a constant baseline of %.0f",
                            point.getDate(), observed, mean))
                    .build());
        }

        double multiple = (observed - mean) / stddev;
        if (multiple <= settings.getStddevFactor()) {
            return Optional.empty();
        }
        Severity severity = multiple >= settings.getCriticalMultiple() ? Severity.CRITICAL : Severity.WARNING;
        return Optional.of(Finding.builder()
                .checkName(NAME)
                .severity(severity)
                .subject(point.getEventName())
                .observed(observed)
                .baseline(mean)
                .detail(String.format("%s: %.0f is %.1f stddev above mean %.1f (stddev %.1f)",
                        point.getDate(), observed, multiple, mean, stddev))
                .build());
    }
}
