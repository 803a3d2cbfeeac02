package com.aletheia.engine.core.matching;

/**
 * Delivers offers to workers. Responses come back separately through the
 * {@link AcceptanceTracker}.
 */
public interface WorkerNotificationChannel {

    /**
     * @throws RuntimeException if the notification could not be sent
     */
    void notify(WorkerNotification notification);
}
