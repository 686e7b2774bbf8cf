package com.microsoft.finops.normalization;

import com.microsoft.finops.domain.model.CloudProvider;

/**
 * A record-level problem found during normalization. Issues degrade a single
 * record (flagged, held or rejected) and never fail the batch.
 */
public record DataQualityIssue(
        IssueType type,
        CloudProvider cloud,
        String accountId,
        String resourceId,
        String detail
) {

    public enum IssueType {
        /** Service absent from the catalog; record kept as "Other". */
        UNMAPPED_SERVICE,
        /** No exchange rate in effect; fact held as pending. */
        CURRENCY_RATE_MISSING,
        /** Missing or inverted usage interval; fact rejected. */
        INVALID_INTERVAL,
        /** Amount sign contradicts the line item type; fact rejected. */
        INVALID_AMOUNT_SIGN,
        /** Fact reported for a different cloud than the adapter's; fact rejected. */
        CLOUD_MISMATCH,
        /** Required identifier (account, service, amount) missing; fact rejected. */
        MISSING_FIELD
    }

    public boolean rejectsRecord() {
        return type != IssueType.UNMAPPED_SERVICE && type != IssueType.CURRENCY_RATE_MISSING;
    }
}
