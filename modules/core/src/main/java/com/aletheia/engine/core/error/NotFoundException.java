package com.aletheia.engine.core.error;

/**
 * Thrown when a task or worker referenced by id does not exist.
 */
public class NotFoundException extends RuntimeException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public static NotFoundException task(String taskId) {
        return new NotFoundException("Task", taskId);
    }

    public static NotFoundException worker(String workerId) {
        return new NotFoundException("Worker", workerId);
    }

    public String kind() {
        return kind;
    }

    public String id() {
        return id;
    }
}
