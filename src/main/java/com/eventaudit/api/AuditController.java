package com.eventaudit.api;

import com.eventaudit.domain.model.AuditReport;
import com.eventaudit.domain.service.AnomalyDetectionService;
import com.eventaudit.infrastructure.cache.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for the report generator and chat layer.
 *
 * Endpoints:
 * - GET /api/v1/audit/checks - Run all checks
 * - GET /api/v1/audit/checks/names - List configured checks
 * - POST /api/v1/audit/checks/{name} - Re-run one check
 * - DELETE /api/v1/audit/cache - Clear both cache tiers
 * - GET /api/v1/audit/cache/stats - Cache counters
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AnomalyDetectionService anomalyDetectionService;

    /**
     * Run every check.
     *
     * Response:
     * {
     *   "findings": [...],
     *   "failures": [{"checkName": "...", "error": "..."}],
     *   "healthScore": 70,
     *   "cacheSources": {"daily_spike": "MEMORY", ...}
     * }
     */
    @GetMapping("/checks")
    public ResponseEntity<AuditReport> runAllChecks() {
        log.info("Run all checks");
        return ResponseEntity.ok(anomalyDetectionService.runAllChecks());
    }

    @GetMapping("/checks/names")
    public ResponseEntity<List<String>> checkNames() {
        return ResponseEntity.ok(anomalyDetectionService.checkNames());
    }

    @PostMapping("/checks/{name}")
    public ResponseEntity<AuditReport> runCheck(@PathVariable String name) {
        log.info("Run check: {}", name);
        return ResponseEntity.ok(anomalyDetectionService.runCheck(name));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Integer>> clearCache() {
        int removed = anomalyDetectionService.clearCache();
        log.info("Cache clear requested, {} entries removed", removed);
        return ResponseEntity.ok(Map.of("removed", removed));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(anomalyDetectionService.cacheStats());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
