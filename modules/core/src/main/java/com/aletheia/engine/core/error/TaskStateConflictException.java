package com.aletheia.engine.core.error;

import com.aletheia.engine.types.TaskStatus;

/**
 * The task exists but is not in a status that allows the requested operation,
 * for example a late submission to a task that already failed.
 */
public class TaskStateConflictException extends ValidationException {

    private final String taskId;
    private final TaskStatus status;

    public TaskStateConflictException(String taskId, TaskStatus status, String message) {
        super(message);
        this.taskId = taskId;
        this.status = status;
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus status() {
        return status;
    }
}
