package com.eventaudit.domain.exception;

/**
 * Not enough history to evaluate a check. Reported as an info finding,
 * not as a failure.
 */
public class InsufficientDataException extends AuditException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
