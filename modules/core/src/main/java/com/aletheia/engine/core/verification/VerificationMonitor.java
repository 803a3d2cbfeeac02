package com.aletheia.engine.core.verification;

import com.aletheia.engine.core.error.InsufficientVerificationsException;
import com.aletheia.engine.core.error.NoWorkersAvailableException;
import com.aletheia.engine.core.error.NotFoundException;
import com.aletheia.engine.core.error.TaskStateConflictException;
import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.failure.FailureHandler;
import com.aletheia.engine.core.service.EngineService;
import com.aletheia.engine.core.task.Task;
import com.aletheia.engine.core.task.TaskStore;
import com.aletheia.engine.types.TaskStatus;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Periodically checks tasks that are not settled yet. First matching rule wins:
 * <ol>
 *   <li>deadline passed: FAILED, "Task expired" (terminal, never retried)</li>
 *   <li>submissions reached the threshold: consolidate to VERIFICATION_COMPLETE</li>
 *   <li>roster smaller than the threshold: FAILED, "Insufficient active workers",
 *       then handed to the {@link FailureHandler}</li>
 *   <li>otherwise: still waiting, status unchanged</li>
 * </ol>
 * Rules 2 and 3 only apply once the task is ASSIGNED or IN_PROGRESS.
 */
@ApplicationScoped
public class VerificationMonitor {

    private static final Logger log = Logger.getLogger(VerificationMonitor.class);

    static final String REASON_EXPIRED = "Task expired";
    static final String REASON_INSUFFICIENT_WORKERS = "Insufficient active workers";

    private static final List<TaskStatus> WATCHED = List.of(
            TaskStatus.ASSIGNED, TaskStatus.IN_PROGRESS, TaskStatus.PENDING, TaskStatus.PENDING_RETRY);

    @Inject
    TaskStore store;

    @Inject
    ResultConsolidator consolidator;

    @Inject
    FailureHandler failureHandler;

    @Inject
    EventBus eventBus;

    @Inject
    EngineService engine;

    @ConfigProperty(name = "aletheia.monitor.batch-size", defaultValue = "100")
    int batchSize;

    @Scheduled(every = "${aletheia.monitor.every:30s}", concurrentExecution = SKIP)
    public void sweep() {
        if (!engine.isRunning()) {
            return;
        }
        checkAll();
    }

    /** Runs {@link #checkProgress} over every watched task; returns how many changed status. */
    int checkAll() {
        int changed = 0;
        for (TaskStatus status : WATCHED) {
            for (Task task : store.queryByStatus(status, null, batchSize)) {
                try {
                    ProgressReport report = checkProgress(task.id(),
                            VerificationRequirements.of(task), task.expiresAt());
                    if (report.status() != task.status()) {
                        changed++;
                    }
                } catch (RuntimeException e) {
                    log.errorf(e, "Progress check failed for task %s", task.id());
                }
            }
        }
        if (changed > 0) {
            log.infof("Verification monitor: %d task(s) changed status", changed);
        }
        return changed;
    }

    /** Checks a task against its own threshold and deadline. */
    public ProgressReport checkProgress(String taskId) {
        Task task = load(taskId);
        return checkProgress(taskId, VerificationRequirements.of(task), task.expiresAt());
    }

    /**
     * @throws NotFoundException if the task does not exist
     */
    public ProgressReport checkProgress(String taskId, VerificationRequirements requirements, Instant expiresAt) {
        Task task = load(taskId);
        TaskStatus status = task.status();
        if (status == TaskStatus.VERIFICATION_COMPLETE || status == TaskStatus.FAILED) {
            return report(task);
        }

        if (expiresAt != null && expiresAt.isBefore(Instant.now())) {
            return report(markFailed(task, REASON_EXPIRED));
        }

        if (!status.acceptsSubmissions()) {
            return report(task);
        }

        int threshold = requirements.verificationThreshold();
        if (task.submissions().size() >= threshold) {
            return consolidate(taskId, threshold);
        }

        if (task.assignedWorkers().size() < threshold) {
            Task failed = markFailed(task, REASON_INSUFFICIENT_WORKERS);
            if (failed.status() == TaskStatus.FAILED && REASON_INSUFFICIENT_WORKERS.equals(failed.statusReason())) {
                failureHandler.handleFailure(taskId, new NoWorkersAvailableException(taskId, String.format(
                        "%d assigned worker(s), %d verifications required", task.assignedWorkers().size(), threshold)));
                return report(load(taskId));
            }
            return report(failed);
        }

        return report(task);
    }

    private ProgressReport consolidate(String taskId, int threshold) {
        try {
            consolidator.consolidate(taskId, threshold);
        } catch (InsufficientVerificationsException | TaskStateConflictException e) {
            log.debugf("Task %s not consolidated: %s", taskId, e.getMessage());
        } catch (NotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            failureHandler.handleFailure(taskId, e);
        }
        return report(load(taskId));
    }

    /** Conditionally moves an unsettled task to FAILED; returns the task as stored afterwards. */
    private Task markFailed(Task task, String reason) {
        var failed = store.conditionalUpdate(task.id(),
                t -> t.status() != TaskStatus.VERIFICATION_COMPLETE && t.status() != TaskStatus.FAILED,
                t -> t.withStatus(TaskStatus.FAILED, reason));
        if (failed.isEmpty()) {
            return load(task.id());
        }
        log.warnf("Task %s (type=%s) marked FAILED: %s", task.id(), task.type(), reason);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", task.id());
        payload.put("reason", reason);
        payload.put("canRetry", false);
        payload.put("completedVerifications", task.submissions().size());
        payload.put("assignedWorkers", task.assignedWorkers().size());
        try {
            eventBus.publish(TaskTopics.TASK_FAILED, payload);
        } catch (RuntimeException e) {
            log.errorf(e, "Task %s: failed to publish %s", task.id(), TaskTopics.TASK_FAILED);
        }
        return failed.get();
    }

    private Task load(String taskId) {
        return store.get(taskId).orElseThrow(() -> NotFoundException.task(taskId));
    }

    private static ProgressReport report(Task task) {
        return new ProgressReport(task.id(), task.status(), task.statusReason(),
                task.submissions().size(), task.assignedWorkers().size());
    }
}
