package com.eventaudit.infrastructure.backend;

/**
 * Names of the backend query classes the audit core issues.
 */
public final class QueryClass {

    public static final String DAILY_SPIKES = "daily_spikes";
    public static final String NULL_RATES = "null_rates";
    public static final String EVENT_DROPOFFS = "event_dropoffs";
    public static final String FRESHNESS = "freshness";

    private QueryClass() {
    }
}
