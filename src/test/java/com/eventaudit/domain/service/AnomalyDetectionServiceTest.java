package com.eventaudit.domain.service;

import com.eventaudit.config.AuditProperties;
import com.eventaudit.domain.check.AuditCheck;
import com.eventaudit.domain.exception.BackendUnavailableException;
import com.eventaudit.domain.exception.ConfigurationMissingException;
import com.eventaudit.domain.exception.InsufficientDataException;
import com.eventaudit.domain.exception.UnknownCheckException;
import com.eventaudit.domain.model.AuditReport;
import com.eventaudit.domain.model.CheckResult;
import com.eventaudit.domain.model.Finding;
import com.eventaudit.domain.model.Severity;
import com.eventaudit.infrastructure.cache.CacheSource;
import com.eventaudit.infrastructure.cache.TieredCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AnomalyDetectionService.
 *
 * Checks run on the calling thread so outcomes are deterministic.
 */
@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-11T12:00:00Z");

    @Mock
    private TieredCache cache;

    @Mock
    private AuditCheck spikes;

    @Mock
    private AuditCheck dropoffs;

    private MeterRegistry meterRegistry;
    private AuditProperties.Checks settings;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        settings = new AuditProperties.Checks();
        settings.setMaxAttempts(2);
        settings.setRetryWait(Duration.ofMillis(1));
    }

    @Test
    void testRunAllChecks_PartialFailureKeepsOtherFindings() {
        // Given
        when(spikes.name()).thenReturn("daily_spike");
        when(dropoffs.name()).thenReturn("event_dropoff");
        when(spikes.run()).thenReturn(new CheckResult("daily_spike",
                List.of(finding("daily_spike", Severity.CRITICAL)), CacheSource.MEMORY));
        when(dropoffs.run()).thenThrow(new BackendUnavailableException("warehouse down"));

        // When
        AuditReport report = service(spikes, dropoffs).runAllChecks();

        // Then
        assertEquals(1, report.getFindings().size());
        assertEquals(1, report.getFailures().size());
        assertEquals("event_dropoff", report.getFailures().get(0).getCheckName());
        assertEquals("warehouse down", report.getFailures().get(0).getError());
        assertEquals(80, report.getHealthScore());
        assertEquals(CacheSource.MEMORY, report.getCacheSources().get("daily_spike"));
        assertEquals(NOW, report.getGeneratedAt());

        // backend failures get one retry
        verify(dropoffs, times(2)).run();
    }

    @Test
    void testRunAllChecks_RetrySucceedsAfterTransientFailure() {
        // Given
        when(spikes.name()).thenReturn("daily_spike");
        when(spikes.run())
                .thenThrow(new BackendUnavailableException("timeout"))
                .thenReturn(new CheckResult("daily_spike", List.of(), CacheSource.QUERY));

        // When
        AuditReport report = service(spikes).runAllChecks();

        // Then
        assertTrue(report.getFailures().isEmpty());
        assertEquals(100, report.getHealthScore());
        verify(spikes, times(2)).run();
    }

    @Test
    void testRunAllChecks_InsufficientDataIsInfoFinding() {
        // Given
        when(spikes.name()).thenReturn("daily_spike");
        when(spikes.run()).thenThrow(new InsufficientDataException("only 3 days of history"));

        // When
        AuditReport report = service(spikes).runAllChecks();

        // Then
        assertTrue(report.getFailures().isEmpty());
        assertEquals(1, report.getFindings().size());
        Finding info = report.getFindings().get(0);
        assertEquals(Severity.INFO, info.getSeverity());
        assertTrue(info.getDetail().startsWith("Insufficient data"));
        assertEquals(100, report.getHealthScore());
        verify(spikes, times(1)).run();
    }

    @Test
    void testRunAllChecks_MissingConfigurationIsFailureWithoutRetry() {
        // Given
        when(spikes.name()).thenReturn("daily_spike");
        when(spikes.run()).thenThrow(new ConfigurationMissingException("No TTL configured for query class: daily_spikes"));

        // When
        AuditReport report = service(spikes).runAllChecks();

        // Then
        assertEquals(1, report.getFailures().size());
        assertTrue(report.getFailures().get(0).getError().startsWith("Configuration missing"));
        verify(spikes, times(1)).run();
    }

    @Test
    void testRunAllChecks_HealthScoreCountsSeverities() {
        // Given - 1 critical and 2 warnings
        when(spikes.name()).thenReturn("daily_spike");
        when(spikes.run()).thenReturn(new CheckResult("daily_spike", List.of(
                finding("daily_spike", Severity.CRITICAL),
                finding("daily_spike", Severity.WARNING),
                finding("daily_spike", Severity.WARNING),
                finding("daily_spike", Severity.INFO)), CacheSource.PERSISTED));

        // When
        AuditReport report = service(spikes).runAllChecks();

        // Then
        assertEquals(60, report.getHealthScore());
        assertEquals(1, report.count(Severity.CRITICAL));
        assertEquals(2, report.count(Severity.WARNING));
    }

    @Test
    void testRunAllChecks_HealthScoreNeverNegative() {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            findings.add(finding("event_dropoff", Severity.CRITICAL));
        }
        when(dropoffs.name()).thenReturn("event_dropoff");
        when(dropoffs.run()).thenReturn(new CheckResult("event_dropoff", findings, CacheSource.QUERY));

        AuditReport report = service(dropoffs).runAllChecks();

        assertEquals(0, report.getHealthScore());
    }

    @Test
    void testRunCheck_RunsOnlyNamedCheck() {
        // Given
        when(spikes.name()).thenReturn("daily_spike");
        when(dropoffs.name()).thenReturn("event_dropoff");
        when(dropoffs.run()).thenReturn(new CheckResult("event_dropoff", List.of(), CacheSource.MEMORY));

        // When
        AuditReport report = service(spikes, dropoffs).runCheck("event_dropoff");

        // Then
        assertTrue(report.getFindings().isEmpty());
        verify(spikes, never()).run();
    }

    @Test
    void testRunCheck_UnknownNameRejected() {
        when(spikes.name()).thenReturn("daily_spike");

        AnomalyDetectionService service = service(spikes);

        assertThrows(UnknownCheckException.class, () -> service.runCheck("no_such_check"));
    }

    @Test
    void testRunAllChecks_GroupsCriticalIssuesAndRatesCacheHits() {
        // Given
        when(spikes.name()).thenReturn("daily_spike");
        when(dropoffs.name()).thenReturn("event_dropoff");
        when(spikes.run()).thenReturn(new CheckResult("daily_spike", List.of(
                finding("daily_spike", Severity.CRITICAL),
                finding("daily_spike", Severity.WARNING)), CacheSource.MEMORY));
        when(dropoffs.run()).thenReturn(new CheckResult("event_dropoff", List.of(
                finding("event_dropoff", Severity.CRITICAL),
                finding("event_stopped_firing", Severity.CRITICAL)), CacheSource.QUERY));

        // When
        AuditReport report = service(spikes, dropoffs).runAllChecks();

        // Then
        Map<String, List<Finding>> issues = report.getCriticalIssues();
        assertEquals(List.of("daily_spike", "event_dropoff", "event_stopped_firing"), List.copyOf(issues.keySet()));
        assertEquals(1, issues.get("daily_spike").size());
        assertEquals(Severity.CRITICAL, issues.get("daily_spike").get(0).getSeverity());
        assertEquals(0.5, report.getCacheHitRate(), 1e-9);
    }

    @Test
    void testRunAllChecks_NoCacheSourcesMeansZeroHitRate() {
        // Given
        when(spikes.name()).thenReturn("daily_spike");
        when(spikes.run()).thenThrow(new BackendUnavailableException("warehouse down"));

        // When
        AuditReport report = service(spikes).runAllChecks();

        // Then
        assertTrue(report.getCacheSources().isEmpty());
        assertTrue(report.getCriticalIssues().isEmpty());
        assertEquals(0.0, report.getCacheHitRate(), 1e-9);
    }

    @Test
    void testConstructor_RejectsDuplicateNames() {
        when(spikes.name()).thenReturn("daily_spike");
        when(dropoffs.name()).thenReturn("daily_spike");

        assertThrows(IllegalArgumentException.class, () -> service(spikes, dropoffs));
    }

    @Test
    void testClearCache_DelegatesToCache() {
        when(cache.clear()).thenReturn(5);

        assertEquals(5, service().clearCache());
    }

    @Test
    void testRunAllChecks_RecordsCheckMetrics() {
        when(spikes.name()).thenReturn("daily_spike");
        when(spikes.run()).thenReturn(new CheckResult("daily_spike", List.of(), CacheSource.MEMORY));

        service(spikes).runAllChecks();

        assertEquals(1.0, meterRegistry.get("audit.check.executed")
                .tag("check", "daily_spike").tag("result", "success").counter().count());
    }

    private AnomalyDetectionService service(AuditCheck... checks) {
        return new AnomalyDetectionService(List.of(checks), cache, Runnable::run, settings,
                meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Finding finding(String check, Severity severity) {
        return Finding.builder()
                .checkName(check)
                .severity(severity)
                .subject("page_view")
                .observed(1)
                .baseline(0)
                .detail("test")
                .build();
    }
}
