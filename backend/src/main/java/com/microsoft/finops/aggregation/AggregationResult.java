package com.microsoft.finops.aggregation;

import com.microsoft.finops.domain.model.TimeWindow;

import java.util.List;

/**
 * @param scope         canonical text of the filter that was applied
 * @param dataAvailable false when no record matched; distinguishes "no data" from a true zero total
 */
public record AggregationResult(
        String scope,
        GroupBy groupBy,
        TimeWindow window,
        String currency,
        long totalMinorUnits,
        boolean dataAvailable,
        List<GroupedTotal> rows
) {
}
