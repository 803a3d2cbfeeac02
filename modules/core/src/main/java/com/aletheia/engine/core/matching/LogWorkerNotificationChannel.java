package com.aletheia.engine.core.matching;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Development channel: writes each offer to the log.
 */
@ApplicationScoped
@IfBuildProperty(name = "aletheia.task-store.type", stringValue = "memory")
public class LogWorkerNotificationChannel implements WorkerNotificationChannel {

    private static final Logger log = Logger.getLogger(LogWorkerNotificationChannel.class);

    @Override
    public void notify(WorkerNotification notification) {
        log.infof("Offer: task %s -> worker %s (%s, expires %s)", notification.taskId(),
                notification.workerId(), notification.strategy(), notification.expiresAt());
    }
}
