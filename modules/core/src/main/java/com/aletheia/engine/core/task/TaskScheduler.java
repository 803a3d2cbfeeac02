package com.aletheia.engine.core.task;

import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.service.EngineService;
import com.aletheia.engine.types.TaskStatus;
import com.aletheia.engine.types.TaskType;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Feeds PENDING tasks into the matching pipeline by publishing {@code TaskScheduled}.
 *
 * <p>Tasks are grouped by type (groups in order of first appearance) and each group is
 * stably sorted by priority, highest first. The scheduler never changes a task's status;
 * the worker matcher does once workers accepted.
 */
@ApplicationScoped
public class TaskScheduler {

    private static final Logger log = Logger.getLogger(TaskScheduler.class);

    private static final Comparator<Task> BY_PRIORITY_DESC =
            Comparator.comparingInt(Task::priority).reversed();

    @Inject
    TaskStore store;

    @Inject
    EventBus eventBus;

    @Inject
    EngineService engine;

    @ConfigProperty(name = "aletheia.scheduler.batch-size", defaultValue = "100")
    int batchSize;

    @ConfigProperty(name = "aletheia.failure.retry-delay-seconds", defaultValue = "60")
    long retryDelaySeconds;

    @ConfigProperty(name = "aletheia.environment", defaultValue = "development")
    String environment;

    @Scheduled(every = "${aletheia.scheduler.every:10s}", concurrentExecution = SKIP)
    public void sweep() {
        if (!engine.isRunning()) {
            return;
        }
        promoteRetries();
        scheduleReadyTasks();
    }

    /**
     * @return number of {@code TaskScheduled} events published
     */
    public int scheduleReadyTasks() {
        List<Task> pending = store.queryByStatus(TaskStatus.PENDING, null, batchSize);
        if (pending.isEmpty()) {
            return 0;
        }

        int scheduled = 0;
        for (List<Task> group : groupByType(pending).values()) {
            for (Task task : group) {
                try {
                    eventBus.publish(TaskTopics.TASK_SCHEDULED, scheduledPayload(task));
                    scheduled++;
                } catch (RuntimeException e) {
                    log.warnf(e, "Failed to schedule task %s (type=%s), skipping", task.id(), task.type());
                }
            }
        }
        log.infof("Scheduled %d of %d pending task(s)", scheduled, pending.size());
        return scheduled;
    }

    /**
     * Moves PENDING_RETRY tasks whose retry delay has elapsed back to PENDING.
     *
     * @return number of tasks requeued
     */
    public int promoteRetries() {
        Instant now = Instant.now();
        Instant cutoff = now.minus(Duration.ofSeconds(retryDelaySeconds));
        int promoted = 0;
        for (Task task : store.queryByStatus(TaskStatus.PENDING_RETRY, cutoff, batchSize)) {
            try {
                var requeued = store.compareAndSwap(task.id(), task.version(),
                        t -> t.withStatus(TaskStatus.PENDING, "Retry after: " + t.failureReason())
                                .withRetriedAt(now));
                if (requeued.isEmpty()) {
                    log.debugf("Task %s changed before retry promotion, skipping", task.id());
                    continue;
                }
                promoted++;
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("taskId", task.id());
                payload.put("recoveryAttempts", task.recoveryAttempts());
                payload.put("failureReason", task.failureReason());
                payload.put("environment", environment);
                eventBus.publish(TaskTopics.TASK_REQUEUED, payload);
            } catch (RuntimeException e) {
                log.warnf(e, "Failed to requeue task %s", task.id());
            }
        }
        if (promoted > 0) {
            log.infof("Requeued %d task(s) for retry", promoted);
        }
        return promoted;
    }

    static Map<TaskType, List<Task>> groupByType(List<Task> tasks) {
        Map<TaskType, List<Task>> groups = new LinkedHashMap<>();
        for (Task task : tasks) {
            groups.computeIfAbsent(task.type(), t -> new ArrayList<>()).add(task);
        }
        groups.values().forEach(group -> group.sort(BY_PRIORITY_DESC));
        return groups;
    }

    private Map<String, Object> scheduledPayload(Task task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", task.id());
        payload.put("taskType", task.type().name());
        payload.put("priority", task.priority());
        payload.put("environment", environment);
        return payload;
    }
}
