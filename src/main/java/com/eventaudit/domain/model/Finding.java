package com.eventaudit.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One anomaly-detection result. Immutable and scoped to the run that produced it.
 */
@Value
@Builder
public class Finding {
    String checkName;
    Severity severity;
    String subject;
    double observed;
    double baseline;
    String detail;
}
