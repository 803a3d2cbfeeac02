package com.aletheia.engine.core.matching;

import java.util.List;

/**
 * @param acceptedWorkers in order of acceptance, a subset of {@code notifiedWorkers}
 */
public record NotificationOutcome(List<String> notifiedWorkers, List<String> acceptedWorkers) {

    public NotificationOutcome {
        notifiedWorkers = List.copyOf(notifiedWorkers);
        acceptedWorkers = List.copyOf(acceptedWorkers);
    }
}
