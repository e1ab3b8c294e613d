package com.dcarunner.failure;

/**
 * Outcome of classifying a failed fire.
 */
public enum Disposition {
    /** Job stays enabled; the next scheduled fire retries. */
    TRANSIENT,
    /** Non-retryable; job is disabled until the owner re-enables it. */
    FATAL,
    /** Submission outcome unknown; job is disabled for manual reconciliation. */
    AMBIGUOUS;

    public boolean disablesJob() {
        return this != TRANSIENT;
    }
}
