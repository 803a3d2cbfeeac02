package com.aletheia.engine.core.fraud;

import com.aletheia.engine.types.TaskType;

import java.util.List;
import java.util.Map;

/**
 * Lifetime statistics for a worker. Read-only here; owned by the worker-profile subsystem.
 */
public record WorkerMetrics(
        String workerId,
        List<Double> accuracyHistory,
        int accountAgeDays,
        int priorViolations,
        int approvedCount,
        int rejectedCount,
        Map<TaskType, Integer> taskTypeDistribution
) {
    public WorkerMetrics {
        accuracyHistory = accuracyHistory == null ? List.of() : List.copyOf(accuracyHistory);
        taskTypeDistribution = taskTypeDistribution == null ? Map.of() : Map.copyOf(taskTypeDistribution);
    }

    public int totalDecisions() {
        return approvedCount + rejectedCount;
    }
}
