package com.eventaudit.domain.exception;

/**
 * The query backend could not produce a result.
 *
 * Propagates out of the cache to the caller; the detector records it
 * as a per-check failure.
 */
public class BackendUnavailableException extends AuditException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
