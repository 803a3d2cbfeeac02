package com.aletheia.engine.core.matching;

import com.aletheia.engine.types.DistributionStrategy;
import com.aletheia.engine.types.TaskStatus;

import java.util.List;

/**
 * What one matching pass did. {@code assigned} is false when the task was not in a
 * state to be matched, or changed while workers were being asked.
 *
 * @param strategy null when no workers were notified
 */
public record AssignmentResult(
        String taskId,
        boolean assigned,
        TaskStatus status,
        DistributionStrategy strategy,
        List<String> notifiedWorkers,
        List<String> acceptedWorkers
) {
    public AssignmentResult {
        notifiedWorkers = notifiedWorkers == null ? List.of() : List.copyOf(notifiedWorkers);
        acceptedWorkers = acceptedWorkers == null ? List.of() : List.copyOf(acceptedWorkers);
    }

    static AssignmentResult skipped(String taskId, TaskStatus status) {
        return new AssignmentResult(taskId, false, status, null, List.of(), List.of());
    }
}
