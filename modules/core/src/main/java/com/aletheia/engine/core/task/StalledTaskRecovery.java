package com.aletheia.engine.core.task;

import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.service.EngineService;
import com.aletheia.engine.types.TaskStatus;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Returns IN_PROGRESS tasks that have not been touched for
 * {@code aletheia.recovery.stalled-threshold-minutes} to PENDING.
 *
 * <p>The reset is a compare-and-swap on the version read by the scan, so a task that
 * received a submission in between is left alone.
 */
@ApplicationScoped
public class StalledTaskRecovery {

    private static final Logger log = Logger.getLogger(StalledTaskRecovery.class);

    static final String REASON_STALLED = "STALLED";

    @Inject
    TaskStore store;

    @Inject
    EventBus eventBus;

    @Inject
    EngineService engine;

    @ConfigProperty(name = "aletheia.recovery.stalled-threshold-minutes", defaultValue = "60")
    long thresholdMinutes;

    @ConfigProperty(name = "aletheia.recovery.batch-size", defaultValue = "100")
    int batchSize;

    @ConfigProperty(name = "aletheia.environment", defaultValue = "development")
    String environment;

    @Scheduled(every = "${aletheia.recovery.every:60s}", concurrentExecution = SKIP)
    public void sweep() {
        if (!engine.isRunning()) {
            return;
        }
        recoverStalled();
    }

    /**
     * @return number of tasks reset to PENDING
     */
    public int recoverStalled() {
        Instant now = Instant.now();
        Instant cutoff = now.minus(Duration.ofMinutes(thresholdMinutes));
        int reset = 0;
        for (Task task : store.queryByStatus(TaskStatus.IN_PROGRESS, cutoff, batchSize)) {
            try {
                var requeued = store.compareAndSwap(task.id(), task.version(),
                        t -> t.requeued(now, REASON_STALLED));
                if (requeued.isEmpty()) {
                    log.debugf("Task %s progressed since the scan, not reset", task.id());
                    continue;
                }
                reset++;
                log.warnf("Task %s (type=%s) stalled since %s, returned to PENDING (attempt #%d)",
                        task.id(), task.type(), task.updatedAt(), requeued.get().recoveryAttempts());
                publishReset(requeued.get());
            } catch (RuntimeException e) {
                log.errorf(e, "Failed to reset stalled task %s", task.id());
            }
        }
        return reset;
    }

    private void publishReset(Task task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", task.id());
        payload.put("previousStatus", TaskStatus.IN_PROGRESS.name());
        payload.put("newStatus", TaskStatus.PENDING.name());
        payload.put("reason", REASON_STALLED);
        payload.put("workerIds", task.assignedWorkers());
        payload.put("recoveryAttempts", task.recoveryAttempts());
        payload.put("environment", environment);
        eventBus.publish(TaskTopics.TASK_RESET, payload);
    }
}
