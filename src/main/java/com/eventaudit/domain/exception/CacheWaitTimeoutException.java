package com.eventaudit.domain.exception;

/**
 * A caller gave up waiting on an in-flight cache load. The load itself keeps running.
 */
public class CacheWaitTimeoutException extends AuditException {

    public CacheWaitTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
