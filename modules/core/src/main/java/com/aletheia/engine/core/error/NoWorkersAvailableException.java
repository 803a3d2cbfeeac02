package com.aletheia.engine.core.error;

/**
 * Not enough eligible workers to reach quorum.
 */
public class NoWorkersAvailableException extends TaskFailureException {

    public NoWorkersAvailableException(String taskId, String message) {
        super(taskId, message);
    }

    public NoWorkersAvailableException(String taskId, String message, Throwable cause) {
        super(taskId, message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.NO_WORKERS_AVAILABLE;
    }
}
