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

/**
 * Compares each event's volume in the latest period with the prior period.
 *
 * A relative decrease above the threshold is critical when it takes the
 * event from at or above the activity floor to below it, and a warning
 * otherwise. An event with prior volume and no data at all in the latest
 * period is reported separately as stopped firing.
 */
@Slf4j
public class DropOffCheck implements AuditCheck {

    public static final String NAME = "event_dropoff";
    public static final String STOPPED_FIRING = "event_stopped_firing";

    private final AuditDatasetService datasets;
    private final AuditProperties.Dropoff settings;

    public DropOffCheck(AuditDatasetService datasets, AuditProperties.Dropoff settings) {
        this.datasets = datasets;
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run() {
        Dataset<EventSeries> data = datasets.eventVolumes(settings.getPeriodDays());

        LocalDate latestEnd = datasets.lastCompleteDay();
        LocalDate latestStart = latestEnd.minusDays(settings.getPeriodDays() - 1L);
        LocalDate priorStart = latestStart.minusDays(settings.getPeriodDays());

        List<Finding> findings = new ArrayList<>();
        int compared = 0;

        for (Map.Entry<String, List<TimeSeriesPoint>> series : data.getValue().byEvent().entrySet()) {
            String event = series.getKey();
            double prior = 0.0;
            double latest = 0.0;
            boolean latestReported = false;

            for (TimeSeriesPoint point : series.getValue()) {
                LocalDate date = point.getDate();
                if (!date.isBefore(latestStart) && !date.isAfter(latestEnd)) {
                    latest += point.getMetricValue();
                    latestReported = true;
                } else if (!date.isBefore(priorStart) && date.isBefore(latestStart)) {
                    prior += point.getMetricValue();
                }
            }

            if (prior <= 0.0) {
                continue;
            }
            compared++;

            if (!latestReported) {
                findings.add(Finding.builder()
                        .checkName(STOPPED_FIRING)
                        .severity(Severity.CRITICAL)
                        .subject(event)
                        .observed(0)
                        .baseline(prior)
                        .detail(String.format("No data since %s after %.0f events in the prior %d days",
                                latestStart, prior, settings.getPeriodDays()))
                        .build());
                continue;
            }

            double decrease = (prior - latest) / prior;
            if (decrease > settings.getThreshold()) {
                double floor = settings.getMinActivityFloor();
                Severity severity = prior >= floor && latest < floor ? Severity.CRITICAL : Severity.WARNING;
                findings.add(Finding.builder()
                        .checkName(NAME)
                        .severity(severity)
                        .subject(event)
                        .observed(latest)
                        .baseline(prior)
                        .detail(String.format("Volume down %.0f%% (%.0f -> %.0f) over %d days",
                                decrease * 100, prior, latest, settings.getPeriodDays()))
                        .build());
            }
        }

        if (compared == 0) {
            throw new InsufficientDataException("No event has volume in the prior "
                    + settings.getPeriodDays() + "-day period");
        }
        log.info("Drop-off check compared {} events, {} findings", compared, findings.size());
        return new CheckResult(NAME, findings, data.getSource());
    }
}
