package com.eventaudit.domain.service;

import com.eventaudit.config.AuditProperties;
import com.eventaudit.domain.model.Dataset;
import com.eventaudit.domain.model.EventSeries;
import com.eventaudit.domain.model.FreshnessSnapshot;
import com.eventaudit.domain.model.NullRateSample;
import com.eventaudit.domain.model.NullRateSeries;
import com.eventaudit.domain.model.TimeSeriesPoint;
import com.eventaudit.infrastructure.backend.BackendConnector;
import com.eventaudit.infrastructure.backend.QueryClass;
import com.eventaudit.infrastructure.backend.QueryResult;
import com.eventaudit.infrastructure.backend.QuerySpec;
import com.eventaudit.infrastructure.backend.RowValues;
import com.eventaudit.infrastructure.cache.CacheKey;
import com.eventaudit.infrastructure.cache.CacheLookup;
import com.eventaudit.infrastructure.cache.TieredCache;
import com.eventaudit.infrastructure.cache.TtlPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Pulls the datasets the checks evaluate, always through the tiered cache.
 *
 * Query Flow:
 * 1. Build a structured cache key from the query class and its parameters
 * 2. Resolve the TTL for the class (unknown class fails fast)
 * 3. On a miss, query the backend and map rows to a typed series
 *
 * Date ranges end yesterday: today's partial data would read as a drop.
 */
@Slf4j
public class AuditDatasetService {

    private final TieredCache cache;
    private final TtlPolicy ttlPolicy;
    private final BackendConnector backend;
    private final Clock clock;

    public AuditDatasetService(TieredCache cache, TtlPolicy ttlPolicy, BackendConnector backend, Clock clock) {
        this.cache = cache;
        this.ttlPolicy = ttlPolicy;
        this.backend = backend;
        this.clock = clock;
    }

    /**
     * Per-day event counts for the spike check.
     */
    public Dataset<EventSeries> dailyEventCounts(int lookbackDays) {
        return fetch(QueryClass.DAILY_SPIKES, dateRange(lookbackDays), EventSeries.class, this::toEventSeries);
    }

    /**
     * Per-day event counts covering the latest and prior drop-off periods.
     */
    public Dataset<EventSeries> eventVolumes(int periodDays) {
        return fetch(QueryClass.EVENT_DROPOFFS, dateRange(periodDays * 2), EventSeries.class, this::toEventSeries);
    }

    /**
     * Daily null counts for the given (event, field) pairs.
     */
    public Dataset<NullRateSeries> nullRates(List<AuditProperties.FieldThreshold> fields, int lookbackDays) {
        Map<String, Object> params = dateRange(lookbackDays);
        params.put("event_names", List.copyOf(new TreeSet<>(fields.stream().map(AuditProperties.FieldThreshold::getEvent).toList())));
        params.put("field_names", List.copyOf(new TreeSet<>(fields.stream().map(AuditProperties.FieldThreshold::getField).toList())));
        return fetch(QueryClass.NULL_RATES, params, NullRateSeries.class, this::toNullRateSeries);
    }

    public Dataset<FreshnessSnapshot> freshness() {
        return fetch(QueryClass.FRESHNESS, new LinkedHashMap<>(), FreshnessSnapshot.class, this::toFreshness);
    }

    public LocalDate lastCompleteDay() {
        return LocalDate.now(clock).minusDays(1);
    }

    private <T> Dataset<T> fetch(String queryClass, Map<String, Object> params, Class<T> type,
                                 Function<QueryResult, T> mapper) {
        CacheKey key = CacheKey.of(queryClass, params);
        Callable<T> supplier = () -> mapper.apply(backend.execute(QuerySpec.of(queryClass, params)));
        CacheLookup<T> lookup = cache.lookup(key, ttlPolicy.ttlFor(queryClass), type, supplier);
        log.debug("Dataset {} served from {}", key, lookup.getSource());
        return new Dataset<>(lookup.getValue(), lookup.getSource());
    }

    private Map<String, Object> dateRange(int days) {
        LocalDate end = lastCompleteDay();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("start_date", end.minusDays(days - 1L));
        params.put("end_date", end);
        return params;
    }

    private EventSeries toEventSeries(QueryResult result) {
        List<TimeSeriesPoint> points = new ArrayList<>(result.getRows().size());
        for (Map<String, Object> row : result.getRows()) {
            points.add(new TimeSeriesPoint(
                    RowValues.date(row, "date"),
                    RowValues.string(row, "event_name"),
                    RowValues.number(row, "event_count")));
        }
        points.sort(Comparator.comparing(TimeSeriesPoint::getDate).thenComparing(TimeSeriesPoint::getEventName));
        return new EventSeries(points);
    }

    private NullRateSeries toNullRateSeries(QueryResult result) {
        List<NullRateSample> samples = new ArrayList<>(result.getRows().size());
        for (Map<String, Object> row : result.getRows()) {
            samples.add(new NullRateSample(
                    RowValues.date(row, "date"),
                    RowValues.string(row, "event_name"),
                    RowValues.string(row, "field_name"),
                    RowValues.count(row, "null_count"),
                    RowValues.count(row, "total_count")));
        }
        samples.sort(Comparator.comparing(NullRateSample::getDate));
        return new NullRateSeries(samples);
    }

    private FreshnessSnapshot toFreshness(QueryResult result) {
        if (result.isEmpty()) {
            return new FreshnessSnapshot(null, 0);
        }
        Map<String, Object> row = result.getRows().get(0);
        return new FreshnessSnapshot(
                RowValues.instant(row, "latest_event_time"),
                RowValues.count(row, "events_last_hour"));
    }
}
