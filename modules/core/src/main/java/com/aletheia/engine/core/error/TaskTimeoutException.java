package com.aletheia.engine.core.error;

/**
 * Workers did not respond before the deadline.
 */
public class TaskTimeoutException extends TaskFailureException {

    public TaskTimeoutException(String taskId, String message) {
        super(taskId, message);
    }

    public TaskTimeoutException(String taskId, String message, Throwable cause) {
        super(taskId, message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TIMEOUT;
    }
}
