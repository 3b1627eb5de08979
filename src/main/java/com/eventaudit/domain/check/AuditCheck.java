package com.eventaudit.domain.check;

import com.eventaudit.domain.model.CheckResult;

/**
 * One anomaly check. Implementations pull their data through the cache
 * and return findings; they hold no state between runs.
 *
 * @throws com.eventaudit.domain.exception.InsufficientDataException when
 *         there is not enough history to evaluate anything
 */
public interface AuditCheck {

    String name();

    CheckResult run();
}
