package com.aletheia.engine.core.matching;

import com.aletheia.engine.types.DistributionStrategy;

import java.time.Instant;

/**
 * Offer of a task to one worker. The worker must accept before {@code expiresAt}.
 */
public record WorkerNotification(String taskId, String workerId, DistributionStrategy strategy, Instant expiresAt) {
}
