package com.microsoft.finops.domain.model;

/**
 * Violation workflow states. Only an explicit user action moves a violation
 * out of OPEN; the rule engine never closes one.
 */
public enum ViolationStatus {
    OPEN,

    /**
     * Exception granted, the resource may stay as it is.
     */
    APPROVED,

    /**
     * Exception refused, remediation expected.
     */
    REJECTED
}
