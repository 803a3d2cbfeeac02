package com.aletheia.engine.core.task;

import com.aletheia.engine.types.TaskType;
import com.aletheia.engine.types.UrgencyLevel;

import java.time.Instant;
import java.util.Map;

/**
 * Intake request for a task. Optional fields are null when the caller leaves them out.
 */
public record NewTask(
        String id,
        TaskType type,
        Integer priority,
        UrgencyLevel urgency,
        Map<String, Object> content,
        Integer verificationThreshold,
        Instant expiresAt
) {}
