package com.microsoft.finops.store;

import com.microsoft.finops.domain.model.BatchStatus;
import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.domain.model.PendingCostFact;
import com.microsoft.finops.domain.model.TimeWindow;

import java.time.Instant;
import java.util.List;

/**
 * Everything one ingestion batch writes, committed atomically by {@link CostStore}.
 *
 * @param message note stored on the batch, e.g. why a PARTIAL batch is partial
 */
public record BatchCommit(
        String batchId,
        CloudProvider cloud,
        TimeWindow window,
        BatchStatus status,
        List<CostRecord> records,
        List<PendingCostFact> pending,
        int issueCount,
        String configVersion,
        String message,
        Instant startedAt
) {
    public BatchCommit {
        records = List.copyOf(records);
        pending = List.copyOf(pending);
    }
}
