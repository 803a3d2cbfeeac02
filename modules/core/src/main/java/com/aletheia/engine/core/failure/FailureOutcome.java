package com.aletheia.engine.core.failure;

import com.aletheia.engine.core.error.FailureKind;
import com.aletheia.engine.types.TaskStatus;

/**
 * What the failure handler decided for one failure occurrence.
 *
 * @param recoveryAttempts attempts counted so far, including this one
 * @param isRecoverable    true when the task was put back in line as PENDING_RETRY
 */
public record FailureOutcome(
        String taskId,
        FailureKind kind,
        String failureReason,
        int recoveryAttempts,
        boolean isRecoverable,
        TaskStatus status
) {}
