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
import com.eventaudit.infrastructure.cache.CacheSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DropOffCheck, with one-day periods ending 2024-03-10.
 */
@ExtendWith(MockitoExtension.class)
class DropOffCheckTest {

    private static final LocalDate LAST_COMPLETE = LocalDate.of(2024, 3, 10);
    private static final LocalDate PRIOR = LAST_COMPLETE.minusDays(1);

    @Mock
    private AuditDatasetService datasets;

    private DropOffCheck dropOffCheck;

    @BeforeEach
    void setUp() {
        AuditProperties.Dropoff settings = new AuditProperties.Dropoff();
        settings.setPeriodDays(1);
        dropOffCheck = new DropOffCheck(datasets, settings);
    }

    @Test
    void testRun_ClassifiesDecreases() {
        // Given
        stubSeries(List.of(
                new TimeSeriesPoint(PRIOR, "purchase", 10000),
                new TimeSeriesPoint(LAST_COMPLETE, "purchase", 6000),
                new TimeSeriesPoint(PRIOR, "share", 10),
                new TimeSeriesPoint(LAST_COMPLETE, "share", 6),
                new TimeSeriesPoint(PRIOR, "add_to_cart", 500),
                new TimeSeriesPoint(LAST_COMPLETE, "add_to_cart", 50),
                new TimeSeriesPoint(PRIOR, "page_view", 1000),
                new TimeSeriesPoint(LAST_COMPLETE, "page_view", 950)));

        // When
        CheckResult result = dropOffCheck.run();

        // Then
        Map<String, Finding> bySubject = result.getFindings().stream()
                .collect(Collectors.toMap(Finding::getSubject, Function.identity()));
        assertEquals(3, bySubject.size());

        // still above the activity floor afterwards
        Finding purchase = bySubject.get("purchase");
        assertEquals(Severity.WARNING, purchase.getSeverity());
        assertEquals(6000, purchase.getObserved(), 1e-9);
        assertEquals(10000, purchase.getBaseline(), 1e-9);

        // never reached the floor
        assertEquals(Severity.WARNING, bySubject.get("share").getSeverity());

        // fell from above the floor to below it
        assertEquals(Severity.CRITICAL, bySubject.get("add_to_cart").getSeverity());
        assertFalse(bySubject.containsKey("page_view"));
    }

    @Test
    void testRun_LandingExactlyOnFloorIsWarning() {
        stubSeries(List.of(
                new TimeSeriesPoint(PRIOR, "purchase", 200),
                new TimeSeriesPoint(LAST_COMPLETE, "purchase", 100)));

        CheckResult result = dropOffCheck.run();

        assertEquals(1, result.getFindings().size());
        assertEquals(Severity.WARNING, result.getFindings().get(0).getSeverity());
    }

    @Test
    void testRun_EventWithNoRecentDataStoppedFiring() {
        // Given
        stubSeries(List.of(
                new TimeSeriesPoint(PRIOR, "sign_up", 500),
                new TimeSeriesPoint(PRIOR, "page_view", 1000),
                new TimeSeriesPoint(LAST_COMPLETE, "page_view", 1000)));

        // When
        CheckResult result = dropOffCheck.run();

        // Then
        assertEquals(1, result.getFindings().size());
        Finding finding = result.getFindings().get(0);
        assertEquals(DropOffCheck.STOPPED_FIRING, finding.getCheckName());
        assertEquals(Severity.CRITICAL, finding.getSeverity());
        assertEquals("sign_up", finding.getSubject());
        assertEquals(0, finding.getObserved(), 1e-9);
    }

    @Test
    void testRun_NewEventsAreNotCompared() {
        stubSeries(List.of(
                new TimeSeriesPoint(LAST_COMPLETE, "new_event", 50),
                new TimeSeriesPoint(PRIOR, "page_view", 1000),
                new TimeSeriesPoint(LAST_COMPLETE, "page_view", 1100)));

        CheckResult result = dropOffCheck.run();

        assertTrue(result.getFindings().isEmpty());
    }

    @Test
    void testRun_NoPriorVolumeIsInsufficient() {
        stubSeries(List.of(new TimeSeriesPoint(LAST_COMPLETE, "page_view", 1000)));

        assertThrows(InsufficientDataException.class, () -> dropOffCheck.run());
    }

    private void stubSeries(List<TimeSeriesPoint> points) {
        when(datasets.eventVolumes(1)).thenReturn(new Dataset<>(new EventSeries(points), CacheSource.MEMORY));
        when(datasets.lastCompleteDay()).thenReturn(LAST_COMPLETE);
    }
}
