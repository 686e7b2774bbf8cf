package com.microsoft.finops.budget;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Derived state of a budget as of a date. Never persisted.
 *
 * @param consumedPct        consumed / amount in percent, truncated to 2 decimals
 * @param expectedPct        elapsed share of the period in percent
 * @param forecastMinorUnits run-rate projection to period end; null with insufficient data
 * @param varianceMinorUnits forecast minus budget amount; null with insufficient data
 */
public record BudgetStatus(
        Long budgetId,
        String name,
        String scope,
        String currency,
        LocalDate periodStart,
        LocalDate periodEnd,
        LocalDate asOf,
        long daysElapsed,
        long daysInPeriod,
        long amountMinorUnits,
        long consumedMinorUnits,
        BigDecimal consumedPct,
        BigDecimal expectedPct,
        BudgetHealth status,
        Long forecastMinorUnits,
        Long varianceMinorUnits,
        boolean alertTriggered
) {
}
