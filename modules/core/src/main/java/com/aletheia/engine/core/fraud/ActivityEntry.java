package com.aletheia.engine.core.fraud;

import com.aletheia.engine.types.TaskType;

import java.time.Instant;
import java.util.Objects;

/**
 * One past verification by the worker, as recorded by the worker-profile subsystem.
 */
public record ActivityEntry(
        TaskType taskType,
        Decision decision,
        double processingTimeSeconds,
        Instant timestamp
) {
    public enum Decision { APPROVED, REJECTED }

    public ActivityEntry {
        Objects.requireNonNull(decision, "decision cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }
}
