package com.microsoft.finops.ingestion;

import com.microsoft.finops.domain.model.BatchStatus;
import com.microsoft.finops.domain.model.CloudProvider;

/**
 * Outcome of syncing one cloud for one window.
 *
 * @param totalMinorUnits sum of the committed records, organization currency
 * @param message         failure or truncation detail, null on a clean commit
 */
public record CloudSyncResult(
        CloudProvider cloud,
        String batchId,
        BatchStatus status,
        int recordCount,
        int pendingCount,
        int issueCount,
        long totalMinorUnits,
        String message
) {
    public static CloudSyncResult failed(CloudProvider cloud, String batchId, String message) {
        return new CloudSyncResult(cloud, batchId, BatchStatus.FAILED, 0, 0, 0, 0, message);
    }

    public boolean succeeded() {
        return status == BatchStatus.COMMITTED;
    }
}
