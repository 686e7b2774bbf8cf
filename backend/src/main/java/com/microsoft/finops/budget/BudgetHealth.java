package com.microsoft.finops.budget;

public enum BudgetHealth {
    ON_TRACK,
    AT_RISK,
    OVER,
    /**
     * Nothing of the period has elapsed yet; no run rate can be computed.
     */
    INSUFFICIENT_DATA
}
