package com.aletheia.engine.types;

/**
 * Lifecycle status of a verification task.
 *
 * <p>Forward path: {@code PENDING -> ASSIGNED -> IN_PROGRESS -> VERIFICATION_COMPLETE | FAILED}.
 * The only backward edges are {@code IN_PROGRESS -> PENDING} (stall reset) and
 * {@code FAILED -> PENDING_RETRY -> PENDING} (recoverable failure).
 */
public enum TaskStatus {
    PENDING(0, "PENDING"),
    ASSIGNED(1, "ASSIGNED"),
    IN_PROGRESS(2, "IN_PROGRESS"),
    VERIFICATION_COMPLETE(3, "VERIFICATION_COMPLETE"),
    FAILED(4, "FAILED"),
    PENDING_RETRY(5, "PENDING_RETRY");

    private final int id;
    private final String label;

    TaskStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    /** True while workers are on the roster and submissions are being collected. */
    public boolean acceptsSubmissions() {
        return this == ASSIGNED || this == IN_PROGRESS;
    }

    public static TaskStatus fromId(int id) {
        for (TaskStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown TaskStatus id: " + id);
    }
}
