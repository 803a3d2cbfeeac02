package com.aletheia.engine.core.verification;

import com.aletheia.engine.core.error.ValidationException;
import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.task.Task;
import com.aletheia.engine.core.task.TaskStore;
import com.aletheia.engine.core.task.VerificationResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accepts one submission per worker per task.
 *
 * <p>Field validation happens here; roster membership, uniqueness and task status are
 * enforced by {@link TaskStore#appendSubmission} in the same atomic write as the append.
 */
@ApplicationScoped
public class VerificationCollector {

    private static final Logger log = Logger.getLogger(VerificationCollector.class);

    @Inject
    TaskStore store;

    @Inject
    EventBus eventBus;

    /**
     * @return the task as stored after the append
     * @throws ValidationException for missing or out-of-range fields, an unassigned worker or a duplicate
     * @throws com.aletheia.engine.core.error.NotFoundException if the task does not exist
     * @throws com.aletheia.engine.core.error.TaskStateConflictException if the task no longer accepts submissions
     */
    public Task submitVerification(String taskId, String workerId, VerificationSubmission submission) {
        VerificationResult result = validate(taskId, workerId, submission);
        Task updated = store.appendSubmission(taskId, result);

        log.debugf("Submission stored: task=%s, worker=%s, count=%d/%d",
                taskId, workerId, updated.submissions().size(), updated.verificationThreshold());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", taskId);
        payload.put("workerId", workerId);
        payload.put("submissionCount", updated.submissions().size());
        payload.put("verificationThreshold", updated.verificationThreshold());
        try {
            eventBus.publish(TaskTopics.TASK_SUBMISSION_RECEIVED, payload);
        } catch (RuntimeException e) {
            // The submission is already durable; the monitor picks it up on its next pass.
            log.errorf(e, "Task %s: failed to publish %s", taskId, TaskTopics.TASK_SUBMISSION_RECEIVED);
        }
        return updated;
    }

    private VerificationResult validate(String taskId, String workerId, VerificationSubmission submission) {
        if (taskId == null || taskId.isBlank()) {
            throw new ValidationException("Missing required field: taskId");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new ValidationException("Missing required field: workerId");
        }
        if (submission == null || submission.result() == null) {
            throw new ValidationException("Missing required field: result");
        }
        if (submission.confidence() == null) {
            throw new ValidationException("Missing required field: confidence");
        }
        double confidence = submission.confidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("confidence must be within [0, 1], got: " + confidence);
        }
        if (submission.timeSpentSeconds() == null) {
            throw new ValidationException("Missing required field: timeSpentSeconds");
        }
        double timeSpent = submission.timeSpentSeconds();
        if (Double.isNaN(timeSpent) || timeSpent <= 0.0) {
            throw new ValidationException("timeSpentSeconds must be > 0, got: " + timeSpent);
        }
        return new VerificationResult(workerId, submission.result(), confidence, timeSpent,
                Instant.now(), submission.metadata());
    }
}
