package com.aletheia.engine.core.matching;

import com.aletheia.engine.core.fraud.WorkerActivity;
import com.aletheia.engine.core.fraud.WorkerMetrics;
import com.aletheia.engine.types.TaskType;

import java.util.Objects;
import java.util.Set;

/**
 * A worker profile as offered by the {@link WorkerDirectory}.
 *
 * @param taskTypes  types the worker takes; empty means any
 * @param matchScore higher is a better fit
 */
public record WorkerCandidate(
        String workerId,
        Set<TaskType> taskTypes,
        double matchScore,
        WorkerActivity activity,
        WorkerMetrics metrics
) {
    public WorkerCandidate {
        Objects.requireNonNull(workerId, "workerId cannot be null");
        taskTypes = taskTypes == null ? Set.of() : Set.copyOf(taskTypes);
    }

    public boolean accepts(TaskType type) {
        return taskTypes.isEmpty() || taskTypes.contains(type);
    }
}
