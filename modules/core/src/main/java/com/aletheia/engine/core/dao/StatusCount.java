package com.aletheia.engine.core.dao;

import com.aletheia.engine.types.TaskStatus;

public record StatusCount(TaskStatus status, long tasks) {
}
