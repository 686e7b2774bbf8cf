package com.microsoft.finops.domain.model;

/**
 * Outcome of the most recent commit for an ingestion batch.
 */
public enum BatchStatus {
    /**
     * All facts fetched, normalized and committed atomically.
     */
    COMMITTED,

    /**
     * Source returned a truncated result. What arrived is committed and the
     * truncation is surfaced in the sync status.
     */
    PARTIAL,

    /**
     * Source or auth failure before anything was ever committed for this window.
     */
    FAILED;

    public boolean isVisible() {
        return this == COMMITTED || this == PARTIAL;
    }
}
