package com.eventaudit.domain.exception;

/**
 * No configured check has the requested name.
 */
public class UnknownCheckException extends AuditException {

    public UnknownCheckException(String message) {
        super(message);
    }
}
