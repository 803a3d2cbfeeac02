package com.aletheia.engine.api;

import com.aletheia.engine.types.TaskStatus;

public record SubmissionAck(String taskId, String workerId, int submissionCount, int verificationThreshold,
                            TaskStatus status) {
}
