package com.eventaudit.infrastructure.backend;

/**
 * The billed query backend, as seen by the audit core.
 */
public interface BackendConnector {

    /**
     * Run the query bound to {@code spec.queryClass}.
     *
     * @throws com.eventaudit.domain.exception.BackendUnavailableException when the backend fails
     * @throws com.eventaudit.domain.exception.ConfigurationMissingException when the class has no query
     */
    QueryResult execute(QuerySpec spec);
}
