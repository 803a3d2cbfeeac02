package com.aletheia.engine.core.error;

/**
 * Classification of a task failure, fixed where the failure originates.
 */
public enum FailureKind {
    TIMEOUT("Task execution timed out"),
    NO_WORKERS_AVAILABLE("No eligible workers available"),
    CONSENSUS_FAILED("Failed to reach consensus"),
    PAYMENT_FAILED("Payment processing failed"),
    UNKNOWN(null);

    private final String reason;

    FailureKind(String reason) {
        this.reason = reason;
    }

    /** Human-readable reason recorded on the task, or null for UNKNOWN. */
    public String reason() {
        return reason;
    }

    public static FailureKind of(Throwable error) {
        if (error instanceof TaskFailureException failure) {
            return failure.kind();
        }
        return UNKNOWN;
    }
}
