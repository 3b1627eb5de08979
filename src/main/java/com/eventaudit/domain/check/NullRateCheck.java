package com.eventaudit.domain.check;

import com.eventaudit.config.AuditProperties;
import com.eventaudit.domain.exception.InsufficientDataException;
import com.eventaudit.domain.model.CheckResult;
import com.eventaudit.domain.model.Dataset;
import com.eventaudit.domain.model.Finding;
import com.eventaudit.domain.model.NullRateSample;
import com.eventaudit.domain.model.NullRateSeries;
import com.eventaudit.domain.model.Severity;
import com.eventaudit.domain.service.AuditDatasetService;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Null-rate check for a table of (field, event, thresholds).
 *
 * Two independent signals per pair:
 * - absolute: a day's null rate above the pair's warning or critical threshold
 * - trend: over the trailing window the rate never decreases and its
 *   least-squares slope exceeds the slope threshold, even when every day is
 *   still below the thresholds
 *
 * The completeness checks (store, loyalty, promotion, recipe) are instances
 * of this class with their own name and field table.
 */
@Slf4j
public class NullRateCheck implements AuditCheck {

    public static final String TREND_SUFFIX = ".trend";

    private final String name;
    private final List<AuditProperties.FieldThreshold> fields;
    private final AuditDatasetService datasets;
    private final AuditProperties.NullRate settings;

    public NullRateCheck(String name,
                         List<AuditProperties.FieldThreshold> fields,
                         AuditDatasetService datasets,
                         AuditProperties.NullRate settings) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Null-rate check '" + name + "' needs at least one field");
        }
        this.name = name;
        this.fields = List.copyOf(fields);
        this.datasets = datasets;
        this.settings = settings;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CheckResult run() {
        Dataset<NullRateSeries> data = datasets.nullRates(fields, settings.getLookbackDays());
        LocalDate trendStart = datasets.lastCompleteDay().minusDays(settings.getTrendWindowDays() - 1L);

        List<Finding> findings = new ArrayList<>();
        int pairsWithData = 0;

        for (AuditProperties.FieldThreshold field : fields) {
            List<NullRateSample> samples = samplesFor(data.getValue(), field);
            if (samples.isEmpty()) {
                log.debug("No volume for {}.{} in check {}", field.getEvent(), field.getField(), name);
                continue;
            }
            pairsWithData++;

            for (NullRateSample sample : samples) {
                thresholdFinding(field, sample).ifPresent(findings::add);
            }

            List<NullRateSample> window = samples.stream()
                    .filter(s -> !s.getDate().isBefore(trendStart))
                    .toList();
            trendFinding(field, window).ifPresent(findings::add);
        }

        if (pairsWithData == 0) {
            throw new InsufficientDataException("No volume for any of the " + fields.size()
                    + " tracked fields of " + name);
        }
        log.info("Null-rate check {} evaluated {} field pairs, {} findings", name, pairsWithData, findings.size());
        return new CheckResult(name, findings, data.getSource());
    }

    private List<NullRateSample> samplesFor(NullRateSeries series, AuditProperties.FieldThreshold field) {
        return series.getSamples().stream()
                .filter(s -> s.getEventName().equals(field.getEvent()) && s.getFieldName().equals(field.getField()))
                .filter(NullRateSample::hasVolume)
                .toList();
    }

    private Optional<Finding> thresholdFinding(AuditProperties.FieldThreshold field, NullRateSample sample) {
        double rate = sample.rate();
        Severity severity;
        double threshold;
        if (rate > field.getCritical()) {
            severity = Severity.CRITICAL;
            threshold = field.getCritical();
        } else if (rate > field.getWarning()) {
            severity = Severity.WARNING;
            threshold = field.getWarning();
        } else {
            return Optional.empty();
        }
        return Optional.of(Finding.builder()
                .checkName(name)
                .severity(severity)
                .subject(subject(field))
                .observed(rate)
                .baseline(threshold)
                .detail(String.format("%s: %.1f%% null (%d of %d), threshold %.1f%%",
                        sample.getDate(), rate * 100, sample.getNullCount(), sample.getTotalCount(), threshold * 100))
                .build());
    }

    private Optional<Finding> trendFinding(AuditProperties.FieldThreshold field, List<NullRateSample> window) {
        if (window.size() < settings.getTrendMinPoints()) {
            return Optional.empty();
        }
        List<LocalDate> dates = new ArrayList<>(window.size());
        List<Double> rates = new ArrayList<>(window.size());
        for (NullRateSample sample : window) {
            if (!rates.isEmpty() && sample.rate() < rates.get(rates.size() - 1)) {
                return Optional.empty();
            }
            dates.add(sample.getDate());
            rates.add(sample.rate());
        }

        double slope = SeriesStatistics.slopePerDay(dates, rates);
        if (slope <= settings.getTrendSlopeThreshold()) {
            return Optional.empty();
        }
        double first = rates.get(0);
        double last = rates.get(rates.size() - 1);
        return Optional.of(Finding.builder()
                .checkName(name + TREND_SUFFIX)
                .severity(Severity.WARNING)
                .subject(subject(field))
                .observed(last)
                .baseline(first)
                .detail(String.format("Null rate rising every day since %s: %.1f%% -> %.1f%% (%.2f pts/day)",
                        dates.get(0), first * 100, last * 100, slope * 100))
                .build());
    }

    private static String subject(AuditProperties.FieldThreshold field) {
        return field.getEvent() + "." + field.getField();
    }
}
