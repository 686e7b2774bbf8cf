package com.microsoft.finops.domain.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
