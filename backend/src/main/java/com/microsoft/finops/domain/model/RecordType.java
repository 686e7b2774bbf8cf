package com.microsoft.finops.domain.model;

/**
 * Kind of a cost line. Determines the permitted sign of the amount.
 */
public enum RecordType {
    /**
     * Regular usage charge. Amount must be zero or positive.
     */
    USAGE,

    /**
     * Credit, refund or discount line. Amount must be zero or negative.
     * Credits are always separate records, never an edit of a prior charge.
     */
    CREDIT;

    public boolean permits(long amountMinorUnits) {
        return this == USAGE ? amountMinorUnits >= 0 : amountMinorUnits <= 0;
    }
}
