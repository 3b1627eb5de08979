package com.eventaudit.config;

import com.eventaudit.domain.check.AuditCheck;
import com.eventaudit.domain.check.DropOffCheck;
import com.eventaudit.domain.check.FreshnessCheck;
import com.eventaudit.domain.check.NullRateCheck;
import com.eventaudit.domain.check.SpikeCheck;
import com.eventaudit.domain.service.AnomalyDetectionService;
import com.eventaudit.domain.service.AuditDatasetService;
import com.eventaudit.infrastructure.backend.BackendConnector;
import com.eventaudit.infrastructure.backend.JdbcBackendConnector;
import com.eventaudit.infrastructure.cache.PersistedCacheTier;
import com.eventaudit.infrastructure.cache.TieredCache;
import com.eventaudit.infrastructure.cache.TtlPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wires the cache and the detector from {@link AuditProperties}.
 *
 * Checks are a closed list built here: spike, drop-off, freshness, and one
 * null-rate check per configured profile.
 */
@Slf4j
@Configuration
public class AuditConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One thread per in-flight load. With no queue the pool grows up to the
     * max before anything waits, so a slow key never holds up another key;
     * past the max the caller runs its own load.
     */
    @Bean
    public ThreadPoolTaskExecutor cacheLoaderExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("cache-loader-");
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor auditCheckExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("audit-check-");
        return executor;
    }

    @Bean
    public TtlPolicy ttlPolicy(AuditProperties properties) {
        return new TtlPolicy(properties.getCache().getTtl());
    }

    @Bean
    public TieredCache tieredCache(AuditProperties properties,
                                   ObjectMapper objectMapper,
                                   @Qualifier("cacheLoaderExecutor") ThreadPoolTaskExecutor cacheLoaderExecutor,
                                   Clock clock,
                                   MeterRegistry meterRegistry) {
        AuditProperties.Cache cache = properties.getCache();
        log.info("Persisted cache tier at {}", cache.getDirectory().toAbsolutePath());
        return new TieredCache(
                new PersistedCacheTier(cache.getDirectory(), objectMapper),
                cacheLoaderExecutor,
                clock,
                cache.getWaitTimeout(),
                meterRegistry);
    }

    @Bean
    public JdbcBackendConnector backendConnector(NamedParameterJdbcTemplate jdbcTemplate, AuditProperties properties) {
        return new JdbcBackendConnector(jdbcTemplate, properties.getBackend());
    }

    @Bean
    public AuditDatasetService auditDatasetService(TieredCache tieredCache,
                                                   TtlPolicy ttlPolicy,
                                                   BackendConnector backendConnector,
                                                   Clock clock) {
        return new AuditDatasetService(tieredCache, ttlPolicy, backendConnector, clock);
    }

    @Bean
    public AnomalyDetectionService anomalyDetectionService(AuditProperties properties,
                                                           AuditDatasetService datasets,
                                                           TieredCache tieredCache,
                                                           @Qualifier("auditCheckExecutor") ThreadPoolTaskExecutor auditCheckExecutor,
                                                           MeterRegistry meterRegistry,
                                                           Clock clock) {
        List<AuditCheck> checks = new ArrayList<>();
        checks.add(new SpikeCheck(datasets, properties.getSpike()));
        checks.add(new DropOffCheck(datasets, properties.getDropoff()));
        checks.add(new FreshnessCheck(datasets, properties.getFreshness(), clock));
        for (AuditProperties.Profile profile : properties.getNullRate().getProfiles()) {
            checks.add(new NullRateCheck(profile.getName(), profile.getFields(), datasets, properties.getNullRate()));
        }
        log.info("Configured {} audit checks", checks.size());

        return new AnomalyDetectionService(
                checks, tieredCache, auditCheckExecutor, properties.getChecks(), meterRegistry, clock);
    }
}
