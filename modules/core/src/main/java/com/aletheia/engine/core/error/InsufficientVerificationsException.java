package com.aletheia.engine.core.error;

/**
 * Consolidation was attempted before quorum. Means "not ready yet", not a task failure.
 */
public class InsufficientVerificationsException extends RuntimeException {

    private final String taskId;
    private final int submitted;
    private final int required;

    public InsufficientVerificationsException(String taskId, int submitted, int required) {
        super("Insufficient verifications: " + submitted + " < " + required);
        this.taskId = taskId;
        this.submitted = submitted;
        this.required = required;
    }

    public String taskId() {
        return taskId;
    }

    public int submitted() {
        return submitted;
    }

    public int required() {
        return required;
    }
}
