package com.microsoft.finops.domain.model;

public enum AllocationMethod {
    TAG_BASED,
    ACCOUNT_BASED,
    FIXED_PERCENTAGE
}
