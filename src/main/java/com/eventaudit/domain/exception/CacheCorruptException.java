package com.eventaudit.domain.exception;

/**
 * A persisted cache artifact could not be read or decoded.
 * Never leaves the cache: callers see a miss instead.
 */
public class CacheCorruptException extends AuditException {

    public CacheCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
