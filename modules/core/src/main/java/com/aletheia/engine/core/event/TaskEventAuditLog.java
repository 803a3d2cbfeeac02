package com.aletheia.engine.core.event;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.jboss.logging.Logger;

/**
 * Writes every lifecycle event to the log so a task's history can be reconstructed.
 */
@ApplicationScoped
public class TaskEventAuditLog {

    private static final Logger log = Logger.getLogger(TaskEventAuditLog.class);

    void onTaskEvent(@Observes TaskEvent event) {
        log.infof("[%s] task=%s %s", event.topic(), event.taskId(), event.payload());
    }
}
