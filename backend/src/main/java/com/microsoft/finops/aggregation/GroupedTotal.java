package com.microsoft.finops.aggregation;

import java.math.BigDecimal;

/**
 * One row of an aggregation.
 *
 * @param pctOfTotal            share of the filtered total, 2 decimals; null when the total is zero
 * @param trendMinorUnits       amount of the same group in the comparison period; null when
 *                              no comparison is available
 * @param comparisonAvailable   false when there is no earlier data to compare with
 */
public record GroupedTotal(
        String key,
        long amountMinorUnits,
        BigDecimal pctOfTotal,
        Long trendMinorUnits,
        boolean comparisonAvailable,
        int recordCount
) {
}
