package com.eventaudit.domain.service;

import com.eventaudit.config.AuditProperties;
import com.eventaudit.domain.exception.BackendUnavailableException;
import com.eventaudit.domain.exception.ConfigurationMissingException;
import com.eventaudit.domain.model.Dataset;
import com.eventaudit.domain.model.EventSeries;
import com.eventaudit.domain.model.FreshnessSnapshot;
import com.eventaudit.domain.model.NullRateSeries;
import com.eventaudit.infrastructure.backend.BackendConnector;
import com.eventaudit.infrastructure.backend.QueryClass;
import com.eventaudit.infrastructure.backend.QueryResult;
import com.eventaudit.infrastructure.backend.QuerySpec;
import com.eventaudit.infrastructure.cache.CacheSource;
import com.eventaudit.infrastructure.cache.PersistedCacheTier;
import com.eventaudit.infrastructure.cache.TieredCache;
import com.eventaudit.infrastructure.cache.TtlPolicy;
import com.eventaudit.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests AuditDatasetService against a real tiered cache and a mocked backend.
 */
@ExtendWith(MockitoExtension.class)
class AuditDatasetServiceTest {

    @TempDir
    Path cacheDir;

    @Mock
    private BackendConnector backend;

    private MutableClock clock;
    private TieredCache cache;
    private AuditDatasetService datasetService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-11T10:00:00Z");
        cache = new TieredCache(
                new PersistedCacheTier(cacheDir, new ObjectMapper().registerModule(new JavaTimeModule())),
                Runnable::run,
                clock,
                Duration.ofSeconds(5),
                new SimpleMeterRegistry());
        datasetService = new AuditDatasetService(cache, new TtlPolicy(new AuditProperties.Cache().getTtl()), backend, clock);
    }

    @Test
    void testDailyEventCounts_MapsRowsAndQueriesCompleteDays() {
        // Given
        when(backend.execute(any())).thenReturn(new QueryResult(List.of(
                row("date", LocalDate.of(2024, 3, 10), "event_name", "purchase", "event_count", 950L),
                row("date", LocalDate.of(2024, 3, 9), "event_name", "purchase", "event_count", 1200L))));

        // When
        Dataset<EventSeries> dataset = datasetService.dailyEventCounts(60);

        // Then
        ArgumentCaptor<QuerySpec> spec = ArgumentCaptor.forClass(QuerySpec.class);
        verify(backend).execute(spec.capture());
        assertEquals(QueryClass.DAILY_SPIKES, spec.getValue().getQueryClass());
        assertEquals(LocalDate.of(2024, 1, 11), spec.getValue().getParameters().get("start_date"));
        assertEquals(LocalDate.of(2024, 3, 10), spec.getValue().getParameters().get("end_date"));

        assertEquals(CacheSource.QUERY, dataset.getSource());
        assertEquals(2, dataset.getValue().getPoints().size());
        // sorted by date
        assertEquals(LocalDate.of(2024, 3, 9), dataset.getValue().getPoints().get(0).getDate());
        assertEquals(1200.0, dataset.getValue().getPoints().get(0).getMetricValue(), 1e-9);
    }

    @Test
    void testDailyEventCounts_SharedAcrossCallersWithinTtl() {
        // Given
        when(backend.execute(any())).thenReturn(QueryResult.empty());

        // When
        datasetService.dailyEventCounts(60);
        Dataset<EventSeries> second = datasetService.dailyEventCounts(60);

        // Then
        assertEquals(CacheSource.MEMORY, second.getSource());
        verify(backend, times(1)).execute(any());
    }

    @Test
    void testDailyEventCounts_RequeriedAfterTtl() {
        when(backend.execute(any())).thenReturn(QueryResult.empty());

        datasetService.dailyEventCounts(60);
        clock.advance(Duration.ofHours(6));
        datasetService.dailyEventCounts(60);

        verify(backend, times(2)).execute(any());
    }

    @Test
    void testEventVolumes_CoversTwoPeriods() {
        when(backend.execute(any())).thenReturn(QueryResult.empty());

        datasetService.eventVolumes(7);

        ArgumentCaptor<QuerySpec> spec = ArgumentCaptor.forClass(QuerySpec.class);
        verify(backend).execute(spec.capture());
        assertEquals(QueryClass.EVENT_DROPOFFS, spec.getValue().getQueryClass());
        assertEquals(LocalDate.of(2024, 2, 26), spec.getValue().getParameters().get("start_date"));
    }

    @Test
    void testNullRates_PassesSortedEventAndFieldNames() {
        // Given
        when(backend.execute(any())).thenReturn(new QueryResult(List.of(
                row("date", "2024-03-10", "event_name", "purchase", "field_name", "loyalty_id",
                        "null_count", 90L, "total_count", 100L))));
        List<AuditProperties.FieldThreshold> fields = List.of(
                new AuditProperties.FieldThreshold("store_name", "page_view", 0.5, 0.8),
                new AuditProperties.FieldThreshold("loyalty_id", "purchase", 0.8, 0.95));

        // When
        Dataset<NullRateSeries> dataset = datasetService.nullRates(fields, 14);

        // Then
        ArgumentCaptor<QuerySpec> spec = ArgumentCaptor.forClass(QuerySpec.class);
        verify(backend).execute(spec.capture());
        assertEquals(List.of("page_view", "purchase"), spec.getValue().getParameters().get("event_names"));
        assertEquals(List.of("loyalty_id", "store_name"), spec.getValue().getParameters().get("field_names"));
        assertEquals(0.9, dataset.getValue().getSamples().get(0).rate(), 1e-9);
    }

    @Test
    void testFreshness_NullLatestTime() {
        when(backend.execute(any())).thenReturn(new QueryResult(List.of(
                row("latest_event_time", null, "events_last_hour", 0L))));

        FreshnessSnapshot snapshot = datasetService.freshness().getValue();

        assertNull(snapshot.getLatestEventTime());
        assertEquals(0, snapshot.getEventsLastHour());
    }

    @Test
    void testFreshness_ReadsLatestEventTime() {
        when(backend.execute(any())).thenReturn(new QueryResult(List.of(
                row("latest_event_time", Instant.parse("2024-03-11T09:55:00Z"), "events_last_hour", 4200L))));

        FreshnessSnapshot snapshot = datasetService.freshness().getValue();

        assertEquals(Instant.parse("2024-03-11T09:55:00Z"), snapshot.getLatestEventTime());
        assertEquals(4200, snapshot.getEventsLastHour());
    }

    @Test
    void testFetch_UnknownQueryClassFailsBeforeQuerying() {
        // Given - no TTL for freshness
        AuditDatasetService partial = new AuditDatasetService(cache,
                new TtlPolicy(Map.of(QueryClass.DAILY_SPIKES, Duration.ofHours(6))), backend, clock);

        // When / Then
        assertThrows(ConfigurationMissingException.class, partial::freshness);
        verifyNoInteractions(backend);
    }

    @Test
    void testFetch_BackendFailurePropagatesAndIsNotCached() {
        when(backend.execute(any()))
                .thenThrow(new BackendUnavailableException("warehouse down"))
                .thenReturn(QueryResult.empty());

        assertThrows(BackendUnavailableException.class, () -> datasetService.dailyEventCounts(60));
        Dataset<EventSeries> retried = datasetService.dailyEventCounts(60);

        assertEquals(CacheSource.QUERY, retried.getSource());
        verify(backend, times(2)).execute(any());
    }

    private static Map<String, Object> row(Object... keysAndValues) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            row.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return row;
    }
}
