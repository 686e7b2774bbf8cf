package com.microsoft.finops.domain.model;

import java.time.Instant;

/**
 * (cloud, account, service, resource, period, record type) - the key that
 * last-write-wins deduplication and per-key write serialization operate on.
 * Usage and a credit against the same resource and period are distinct facts.
 */
public record CostRecordKey(
        CloudProvider cloud,
        String accountId,
        String service,
        String resourceId,
        Instant periodStart,
        Instant periodEnd,
        RecordType recordType
) {

    /**
     * Partition the key belongs to. Adapters for different clouds write disjoint partitions.
     */
    public String partition() {
        return cloud + "/" + accountId;
    }
}
