package com.eventaudit.domain.exception;

/**
 * Base type for all audit core failures.
 */
public class AuditException extends RuntimeException {

    public AuditException(String message) {
        super(message);
    }

    public AuditException(String message, Throwable cause) {
        super(message, cause);
    }
}
