package com.aletheia.engine.core.verification;

import com.aletheia.engine.core.error.ConsensusFailedException;
import com.aletheia.engine.core.error.InsufficientVerificationsException;
import com.aletheia.engine.core.error.NotFoundException;
import com.aletheia.engine.core.error.TaskStateConflictException;
import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.payment.PaymentTrigger;
import com.aletheia.engine.core.task.ConsolidatedResult;
import com.aletheia.engine.core.task.Task;
import com.aletheia.engine.core.task.TaskStore;
import com.aletheia.engine.core.task.TaskStoreException;
import com.aletheia.engine.core.task.VerificationResult;
import com.aletheia.engine.types.TaskStatus;
import com.aletheia.engine.util.Averages;
import com.aletheia.engine.util.ResultKey;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a task's submissions to one consolidated result once quorum is reached.
 *
 * <p>Majority: submissions are grouped by {@link ResultKey} in order of first appearance,
 * and on equal sizes the earlier group wins. Confidence and time spent are averaged over
 * all submissions, not just the majority group.
 *
 * <p>The move to VERIFICATION_COMPLETE is a compare-and-swap on the version the result was
 * computed from. A submission landing in between forces a re-read, and concurrent
 * consolidations of the same task complete it once and trigger payment once; the loser
 * returns the stored result.
 */
@ApplicationScoped
public class ResultConsolidator {

    private static final Logger log = Logger.getLogger(ResultConsolidator.class);

    @Inject
    TaskStore store;

    @Inject
    EventBus eventBus;

    @Inject
    PaymentTrigger paymentTrigger;

    /** Minimum share of submissions that must agree with the majority; 0 disables. */
    @ConfigProperty(name = "aletheia.consensus.min-agreement", defaultValue = "0")
    double minAgreement;

    /**
     * @throws InsufficientVerificationsException below quorum; the task is left untouched
     * @throws NotFoundException if the task does not exist
     * @throws TaskStateConflictException if the task left ASSIGNED/IN_PROGRESS for another reason
     * @throws ConsensusFailedException if agreement is below {@code aletheia.consensus.min-agreement}
     * @throws com.aletheia.engine.core.error.PaymentProcessingException if the payment trigger fails
     *         after the task was completed
     */
    public ConsolidatedResult consolidate(String taskId, int verificationThreshold) {
        Task completed = null;
        for (int attempt = 0; completed == null; attempt++) {
            if (attempt == TaskStore.MAX_UPDATE_ATTEMPTS) {
                throw new TaskStoreException("Gave up consolidating task " + taskId + " after "
                        + TaskStore.MAX_UPDATE_ATTEMPTS + " conflicting writes");
            }
            Task task = store.get(taskId).orElseThrow(() -> NotFoundException.task(taskId));
            int submitted = task.submissions().size();
            if (submitted < verificationThreshold) {
                throw new InsufficientVerificationsException(taskId, submitted, verificationThreshold);
            }
            if (!task.status().acceptsSubmissions()) {
                return alreadySettled(task);
            }
            completed = completeIfUnchanged(task);
            if (completed == null) {
                log.debugf("Task %s changed during consolidation, re-reading", taskId);
            }
        }

        ConsolidatedResult result = completed.consolidatedResult();
        log.infof("Task %s consolidated: result=%s, %d/%d agree, confidence=%.3f",
                taskId, result.result(), result.agreementCount(), result.verifierCount(), result.confidence());
        publishCompleted(completed);
        paymentTrigger.trigger(completed);
        return result;
    }

    /**
     * Writes the result computed from {@code task}'s submissions, but only over that exact
     * version, so the stored result always covers the stored submission list.
     *
     * @return the completed task, or null if the task was written in between
     */
    private Task completeIfUnchanged(Task task) {
        String taskId = task.id();
        try {
            ConsolidatedResult result = aggregate(task.submissions(), Instant.now());
            if (minAgreement > 0 && result.agreementRatio() < minAgreement) {
                throw new ConsensusFailedException(taskId, String.format(
                        "Only %d of %d submissions agree (%.2f < %.2f)",
                        result.agreementCount(), result.verifierCount(), result.agreementRatio(), minAgreement));
            }
            return store.compareAndSwap(taskId, task.version(), t -> t.withConsolidatedResult(result))
                    .orElse(null);
        } catch (RuntimeException e) {
            markFailed(taskId, e);
            throw e;
        }
    }

    /**
     * Pure reduction of submissions, in the order given. Submissions are grouped by
     * {@link ResultKey} in order of first appearance; the first group with the largest
     * size is the majority.
     *
     * @throws IllegalArgumentException if {@code submissions} is empty
     */
    public static ConsolidatedResult aggregate(List<VerificationResult> submissions, Instant at) {
        if (submissions.isEmpty()) {
            throw new IllegalArgumentException("Cannot consolidate zero submissions");
        }
        Map<String, List<VerificationResult>> groups = new LinkedHashMap<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (VerificationResult s : submissions) {
            groups.computeIfAbsent(ResultKey.of(s.result()), k -> new ArrayList<>()).add(s);
            metadata.putAll(s.metadata());
        }

        List<VerificationResult> majority = null;
        for (List<VerificationResult> group : groups.values()) {
            if (majority == null || group.size() > majority.size()) {
                majority = group;
            }
        }

        return new ConsolidatedResult(majority.get(0).result(),
                Averages.mean(submissions, VerificationResult::confidence, 0),
                submissions.size(),
                Averages.mean(submissions, VerificationResult::timeSpentSeconds, 0),
                majority.size(), metadata, at);
    }

    private ConsolidatedResult alreadySettled(Task current) {
        if (current.status() == TaskStatus.VERIFICATION_COMPLETE && current.consolidatedResult() != null) {
            log.debugf("Task %s already consolidated, nothing to do", current.id());
            return current.consolidatedResult();
        }
        throw new TaskStateConflictException(current.id(), current.status(),
                "Task " + current.id() + " is " + current.status() + ", not consolidating");
    }

    private void markFailed(String taskId, RuntimeException cause) {
        String reason = "Consolidation failed: " + cause.getMessage();
        try {
            var failed = store.conditionalUpdate(taskId,
                    t -> t.status().acceptsSubmissions(),
                    t -> t.withStatus(TaskStatus.FAILED, reason));
            if (failed.isEmpty()) {
                return;
            }
            log.warnf("Task %s marked FAILED: %s", taskId, reason);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("taskId", taskId);
            payload.put("reason", reason);
            eventBus.publish(TaskTopics.CONSOLIDATION_FAILED, payload);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.errorf(e, "Task %s: could not record consolidation failure", taskId);
        }
    }

    private void publishCompleted(Task completed) {
        ConsolidatedResult result = completed.consolidatedResult();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("result", result.result());
        details.put("confidence", result.confidence());
        details.put("verifierCount", result.verifierCount());
        details.put("agreementCount", result.agreementCount());
        details.put("averageTimeSpentSeconds", result.averageTimeSpentSeconds());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", completed.id());
        payload.put("completionDetails", details);
        try {
            eventBus.publish(TaskTopics.TASK_COMPLETED, payload);
        } catch (RuntimeException e) {
            log.errorf(e, "Task %s: failed to publish %s", completed.id(), TaskTopics.TASK_COMPLETED);
        }
    }
}
