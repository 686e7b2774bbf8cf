package com.microsoft.finops.ingestion;

import com.microsoft.finops.domain.model.BatchStatus;
import com.microsoft.finops.domain.model.CloudProvider;

import java.time.Instant;

/**
 * Freshness of one cloud's data.
 *
 * lastSyncFailed is true when the latest attempt failed after (or without) the
 * latest successful commit; the data from that commit is still what readers see.
 */
public record SyncStatus(
        CloudProvider cloud,
        String lastCommittedBatchId,
        BatchStatus lastCommittedStatus,
        Instant lastCommittedAt,
        Instant lastFailureAt,
        String lastFailureMessage,
        boolean lastSyncFailed,
        long pendingFacts
) {
}
