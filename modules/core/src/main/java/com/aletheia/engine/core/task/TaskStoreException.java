package com.aletheia.engine.core.task;

/**
 * Wraps persistence failures and unresolvable write contention in the task store.
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public TaskStoreException(String message) {
        super(message);
    }
}
