package com.eventaudit.domain.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * One day of one event's metric. Series are ordered by date; missing days stay missing.
 */
@Value
public class TimeSeriesPoint {
    LocalDate date;
    String eventName;
    double metricValue;
}
