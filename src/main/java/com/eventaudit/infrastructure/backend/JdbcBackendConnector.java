package com.eventaudit.infrastructure.backend;

import com.eventaudit.config.AuditProperties;
import com.eventaudit.domain.exception.AuditException;
import com.eventaudit.domain.exception.BackendUnavailableException;
import com.eventaudit.domain.exception.ConfigurationMissingException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend connector over JDBC.
 *
 * Each query class maps to a SQL template supplied in configuration
 * ({@code audit.backend.queries.<class>}); query spec parameters bind to its
 * named parameters. Circuit breaker keeps a failing warehouse from being
 * hammered by every check.
 */
@Slf4j
public class JdbcBackendConnector implements BackendConnector {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final Map<String, String> queries;

    public JdbcBackendConnector(NamedParameterJdbcTemplate jdbcTemplate, AuditProperties.Backend backend) {
        this.jdbcTemplate = jdbcTemplate;
        this.queries = Map.copyOf(backend.getQueries());
    }

    @Override
    @CircuitBreaker(name = "backend", fallbackMethod = "executeFallback")
    public QueryResult execute(QuerySpec spec) {
        String sql = queries.get(spec.getQueryClass());
        if (sql == null || sql.isBlank()) {
            throw new ConfigurationMissingException("No backend query configured for class: " + spec.getQueryClass());
        }

        long startTime = System.currentTimeMillis();
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, spec.getParameters());
            log.info("Backend query {} returned {} rows in {} ms",
                    spec.getQueryClass(), rows.size(), System.currentTimeMillis() - startTime);
            return new QueryResult(normalize(rows));
        } catch (DataAccessException e) {
            log.error("Backend query {} failed: {}", spec.getQueryClass(), e.getMessage());
            throw new BackendUnavailableException("Backend query failed for " + spec.getQueryClass(), e);
        }
    }

    private QueryResult executeFallback(QuerySpec spec, Exception e) {
        if (e instanceof AuditException auditException) {
            throw auditException;
        }
        log.warn("Backend circuit breaker open, rejecting query {}", spec.getQueryClass());
        throw new BackendUnavailableException("Backend unavailable for " + spec.getQueryClass(), e);
    }

    // JDBC temporal types become java.time so rows serialize the same way they deserialize
    private List<Map<String, Object>> normalize(List<Map<String, Object>> rows) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            row.forEach((column, value) -> normalized.put(column.toLowerCase(), normalizeValue(value)));
            out.add(normalized);
        }
        return out;
    }

    private Object normalizeValue(Object value) {
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        return value;
    }
}
