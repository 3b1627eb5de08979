package com.eventaudit.domain.model;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
