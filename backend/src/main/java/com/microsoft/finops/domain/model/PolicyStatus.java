package com.microsoft.finops.domain.model;

/**
 * Disabling a policy stops new evaluation only; existing violations stay.
 */
public enum PolicyStatus {
    ACTIVE,
    DISABLED
}
