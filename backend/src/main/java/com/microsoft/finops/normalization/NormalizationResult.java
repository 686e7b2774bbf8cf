package com.microsoft.finops.normalization;

import com.microsoft.finops.adapters.RawCostFact;
import com.microsoft.finops.domain.model.CostRecord;

import java.util.List;

/**
 * Output of one normalization run.
 *
 * @param records deduplicated canonical records, one per natural key
 * @param held    facts waiting for an exchange rate
 * @param issues  every data-quality problem encountered, including the ones behind held facts
 */
public record NormalizationResult(
        List<CostRecord> records,
        List<HeldFact> held,
        List<DataQualityIssue> issues
) {

    public record HeldFact(RawCostFact fact, String reason) {
    }

    public long totalMinorUnits() {
        return records.stream().mapToLong(CostRecord::getAmountMinorUnits).sum();
    }
}
