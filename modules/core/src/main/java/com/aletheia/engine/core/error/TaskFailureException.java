package com.aletheia.engine.core.error;

/**
 * Base for domain failures that the failure handler may retry.
 * Each subclass pins its {@link FailureKind}.
 */
public abstract class TaskFailureException extends RuntimeException {

    private final String taskId;

    protected TaskFailureException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    protected TaskFailureException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public abstract FailureKind kind();

    public String taskId() {
        return taskId;
    }
}
