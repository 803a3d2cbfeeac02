package com.aletheia.engine.core.matching;

import com.aletheia.engine.core.error.NoWorkersAvailableException;
import com.aletheia.engine.core.error.NotFoundException;
import com.aletheia.engine.core.error.TaskFailureException;
import com.aletheia.engine.core.error.TaskTimeoutException;
import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.event.TaskEvent;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.failure.FailureHandler;
import com.aletheia.engine.core.fraud.FraudDetectionResult;
import com.aletheia.engine.core.fraud.FraudRiskScorer;
import com.aletheia.engine.core.task.Task;
import com.aletheia.engine.core.task.TaskStore;
import com.aletheia.engine.types.DistributionStrategy;
import com.aletheia.engine.types.TaskStatus;
import com.aletheia.engine.types.UrgencyLevel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.ObservesAsync;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a scheduled PENDING task into an ASSIGNED one: picks eligible workers, offers
 * them the task and merges whoever accepted into the roster.
 *
 * <p>Workers whose current fraud level is HIGH or CRITICAL are never offered a task,
 * whatever the directory says. Matching failures are handed to the {@link FailureHandler}.
 */
@ApplicationScoped
public class WorkerMatcher {

    private static final Logger log = Logger.getLogger(WorkerMatcher.class);

    @Inject
    TaskStore store;

    @Inject
    WorkerDirectory directory;

    @Inject
    FraudRiskScorer fraudScorer;

    @Inject
    WorkerNotifier notifier;

    @Inject
    AcceptanceTracker tracker;

    @Inject
    FailureHandler failureHandler;

    @Inject
    EventBus eventBus;

    @ConfigProperty(name = "aletheia.matching.max-workers-per-task", defaultValue = "10")
    int maxWorkersPerTask;

    void onTaskScheduled(@ObservesAsync TaskEvent event) {
        if (!event.is(TaskTopics.TASK_SCHEDULED)) {
            return;
        }
        String taskId = event.taskId();
        try {
            assign(taskId);
        } catch (TaskFailureException e) {
            failureHandler.handleFailure(taskId, e);
        } catch (NotFoundException e) {
            log.warnf("Scheduled task %s no longer exists", taskId);
        } catch (RuntimeException e) {
            log.errorf(e, "Matching failed for task %s", taskId);
        }
    }

    /**
     * @throws NoWorkersAvailableException if nobody is eligible or too few workers accepted
     * @throws TaskTimeoutException if no notified worker accepted within the window
     * @throws NotFoundException if the task does not exist
     */
    public AssignmentResult assign(String taskId) {
        Task task = store.get(taskId).orElseThrow(() -> NotFoundException.task(taskId));
        if (task.status() != TaskStatus.PENDING || task.isExpired(Instant.now())) {
            log.debugf("Task %s is %s, not matching", taskId, task.status());
            return AssignmentResult.skipped(taskId, task.status());
        }
        if (tracker.isOpen(taskId)) {
            log.debugf("Task %s is already waiting for acceptances", taskId);
            return AssignmentResult.skipped(taskId, task.status());
        }

        int needed = task.verificationThreshold() - task.submissions().size();
        if (needed <= 0) {
            // Quorum already collected on an earlier attempt; only consolidation is left.
            return commit(task, List.of(), null, List.of());
        }

        List<WorkerCandidate> candidates = eligibleCandidates(task);
        if (candidates.isEmpty()) {
            throw new NoWorkersAvailableException(taskId, "No eligible workers for task " + taskId
                    + " (type=" + task.type() + ")");
        }

        DistributionStrategy strategy = chooseStrategy(task.urgency(), candidates.size());
        List<String> workerIds = candidates.stream().map(WorkerCandidate::workerId).toList();
        NotificationOutcome outcome = notifier.notifyEligibleWorkers(taskId, workerIds, strategy);

        if (outcome.acceptedWorkers().isEmpty()) {
            throw new TaskTimeoutException(taskId, "No worker accepted task " + taskId + " within the notification window");
        }
        if (outcome.acceptedWorkers().size() < needed) {
            throw new NoWorkersAvailableException(taskId, String.format(
                    "Only %d worker(s) accepted task %s, %d needed",
                    outcome.acceptedWorkers().size(), taskId, needed));
        }
        return commit(task, outcome.acceptedWorkers(), strategy, outcome.notifiedWorkers());
    }

    /**
     * Candidates for the task, fraud-screened, without workers that already submitted,
     * best match first and capped at {@code aletheia.matching.max-workers-per-task}.
     */
    public List<WorkerCandidate> eligibleCandidates(Task task) {
        return directory.candidatesFor(task).stream()
                .filter(c -> !task.hasSubmissionFrom(c.workerId()))
                .filter(c -> !isBarred(c))
                .sorted(Comparator.comparingDouble(WorkerCandidate::matchScore).reversed()
                        .thenComparing(WorkerCandidate::workerId))
                .limit(maxWorkersPerTask)
                .toList();
    }

    static DistributionStrategy chooseStrategy(UrgencyLevel urgency, int candidateCount) {
        if (urgency == UrgencyLevel.CRITICAL || candidateCount <= 3) {
            return DistributionStrategy.BROADCAST;
        }
        if (candidateCount <= 5) {
            return DistributionStrategy.TARGETED;
        }
        return DistributionStrategy.AUCTION;
    }

    private boolean isBarred(WorkerCandidate candidate) {
        if (candidate.activity() == null) {
            return false;
        }
        FraudDetectionResult risk = fraudScorer.assessRisk(candidate.activity(), candidate.metrics());
        if (risk.fraudLevel().isFraudulent()) {
            log.infof("Worker %s excluded: fraud level %s (score=%.1f)",
                    candidate.workerId(), risk.fraudLevel(), risk.riskScore());
            return true;
        }
        return false;
    }

    private AssignmentResult commit(Task task, List<String> accepted, DistributionStrategy strategy,
                                    List<String> notified) {
        var assigned = store.conditionalUpdate(task.id(),
                t -> t.status() == TaskStatus.PENDING,
                t -> t.withAssignment(accepted));
        if (assigned.isEmpty()) {
            TaskStatus current = store.get(task.id()).map(Task::status).orElse(null);
            log.infof("Task %s changed to %s while matching, assignment dropped", task.id(), current);
            return new AssignmentResult(task.id(), false, current, strategy, notified, accepted);
        }

        Task updated = assigned.get();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", updated.id());
        payload.put("workerIds", updated.assignedWorkers());
        payload.put("strategy", strategy == null ? null : strategy.name());
        try {
            eventBus.publish(TaskTopics.TASK_ASSIGNED, payload);
        } catch (RuntimeException e) {
            log.errorf(e, "Task %s: failed to publish %s", updated.id(), TaskTopics.TASK_ASSIGNED);
        }
        log.infof("Task %s assigned to %d worker(s)", updated.id(), updated.assignedWorkers().size());
        return new AssignmentResult(updated.id(), true, updated.status(), strategy, notified, accepted);
    }
}
