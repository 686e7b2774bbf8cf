package com.microsoft.finops.exception;

/**
 * An internal invariant did not hold, e.g. allocated amounts do not add up to the
 * aggregate total. This is a defect, never a user-facing condition: it is logged
 * and fails the operation.
 */
public class ConsistencyViolationException extends FinOpsException {

    public ConsistencyViolationException(String message) {
        super(message);
    }
}
