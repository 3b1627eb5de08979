package com.eventaudit.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Most recent ingested event time; {@code latestEventTime} is null when nothing was ingested.
 */
@Value
public class FreshnessSnapshot {
    Instant latestEventTime;
    long eventsLastHour;
}
