package com.microsoft.finops.allocation;

import com.microsoft.finops.domain.model.AllocationDimension;
import com.microsoft.finops.domain.model.AllocationMethod;
import com.microsoft.finops.domain.model.TimeWindow;

import java.util.List;

/**
 * Chargeback mapping for one rule over one scope and window.
 *
 * Entries always include "Unallocated" and sum exactly to totalMinorUnits.
 */
public record AllocationResult(
        Long ruleId,
        String ruleName,
        AllocationDimension dimension,
        AllocationMethod method,
        String scope,
        TimeWindow window,
        String currency,
        long totalMinorUnits,
        boolean dataAvailable,
        List<AllocationEntry> entries
) {

    public long unallocatedMinorUnits() {
        return entries.stream()
                .filter(e -> AllocationEngine.UNALLOCATED.equals(e.key()))
                .mapToLong(AllocationEntry::amountMinorUnits)
                .sum();
    }
}
