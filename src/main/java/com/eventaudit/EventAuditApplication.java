package com.eventaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Event Audit Service
 *
 * Audits analytics event data for volume and quality problems.
 *
 * Architecture:
 * - Tiered result cache (memory + persisted files) in front of the billed warehouse
 * - Single-flight loads: concurrent misses on one key issue one backend query
 * - Anomaly checks over cached series: spikes, drop-offs, null rates, freshness
 * - Partial results: a failing check is reported, the others still run
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EventAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventAuditApplication.class, args);
    }
}
