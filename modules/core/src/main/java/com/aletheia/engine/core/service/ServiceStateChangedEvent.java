package com.aletheia.engine.core.service;

import java.time.Instant;

/**
 * One lifecycle transition of a {@link ManagedService}, fired synchronously over CDI.
 *
 * @param detail failure message when {@code newState} is FAILED, otherwise null
 */
public record ServiceStateChangedEvent(
        String serviceId,
        ManagedService.State oldState,
        ManagedService.State newState,
        String detail,
        Instant occurredAt
) {
    public boolean isFailure() {
        return newState == ManagedService.State.FAILED;
    }
}
