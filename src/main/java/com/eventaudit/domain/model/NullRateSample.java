package com.eventaudit.domain.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * Daily null count for one (field, event) pair.
 */
@Value
public class NullRateSample {
    LocalDate date;
    String eventName;
    String fieldName;
    long nullCount;
    long totalCount;

    public boolean hasVolume() {
        return totalCount > 0;
    }

    public double rate() {
        return totalCount == 0 ? 0.0 : (double) nullCount / totalCount;
    }
}
