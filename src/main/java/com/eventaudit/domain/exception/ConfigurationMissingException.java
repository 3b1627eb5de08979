package com.eventaudit.domain.exception;

/**
 * Requested query class (or query template) is not configured.
 *
 * Indicates a programming or configuration error. Never retried.
 */
public class ConfigurationMissingException extends AuditException {

    public ConfigurationMissingException(String message) {
        super(message);
    }
}
