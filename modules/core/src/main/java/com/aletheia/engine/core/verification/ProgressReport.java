package com.aletheia.engine.core.verification;

import com.aletheia.engine.types.TaskStatus;

/**
 * Result of one monitor check: the task's status afterwards and the counts it was judged on.
 */
public record ProgressReport(
        String taskId,
        TaskStatus status,
        String statusReason,
        int completedVerifications,
        int assignedWorkers
) {}
