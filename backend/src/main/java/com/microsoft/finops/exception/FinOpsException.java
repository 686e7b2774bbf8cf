package com.microsoft.finops.exception;

/**
 * Root of the engine's exception hierarchy.
 *
 * Subtypes map to the four failure classes the engine distinguishes:
 * source failures, configuration errors, consistency violations and lookups
 * of unknown entities. Data-quality problems are not exceptions; they degrade
 * into flagged records (see DataQualityIssue).
 */
public class FinOpsException extends RuntimeException {

    public FinOpsException(String message) {
        super(message);
    }

    public FinOpsException(String message, Throwable cause) {
        super(message, cause);
    }
}
