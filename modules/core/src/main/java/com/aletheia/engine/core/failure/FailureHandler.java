package com.aletheia.engine.core.failure;

import com.aletheia.engine.core.error.FailureKind;
import com.aletheia.engine.core.error.NotFoundException;
import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.task.Task;
import com.aletheia.engine.core.task.TaskStore;
import com.aletheia.engine.types.AlertSeverity;
import com.aletheia.engine.types.TaskStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classifies a task failure and decides between another attempt (PENDING_RETRY)
 * and the terminal FAILED state.
 *
 * <p>Each occurrence counts one recovery attempt. A failure is recoverable only if its
 * kind is configured retryable and the attempt count has not passed
 * {@code aletheia.failure.max-recovery-attempts}; unknown errors never are.
 */
@ApplicationScoped
public class FailureHandler {

    private static final Logger log = Logger.getLogger(FailureHandler.class);

    @Inject
    TaskStore store;

    @Inject
    EventBus eventBus;

    @Inject
    AlertSink alertSink;

    @ConfigProperty(name = "aletheia.failure.max-recovery-attempts", defaultValue = "3")
    int maxRecoveryAttempts;

    @ConfigProperty(name = "aletheia.failure.retry.timeout", defaultValue = "true")
    boolean retryTimeout;

    @ConfigProperty(name = "aletheia.failure.retry.no-workers", defaultValue = "true")
    boolean retryNoWorkers;

    @ConfigProperty(name = "aletheia.failure.retry.consensus-failed", defaultValue = "true")
    boolean retryConsensusFailed;

    @ConfigProperty(name = "aletheia.failure.retry.payment-failed", defaultValue = "false")
    boolean retryPaymentFailed;

    /**
     * Records the failure on the task, publishes {@code TaskFailed} and raises an alert.
     *
     * @throws NotFoundException if the task does not exist
     */
    public FailureOutcome handleFailure(String taskId, Throwable error) {
        FailureKind kind = FailureKind.of(error);
        String reason = reasonFor(kind, error);
        boolean retryable = isRetryable(kind);

        Task updated = store.conditionalUpdate(taskId, t -> true, t -> {
            int attempts = t.recoveryAttempts() + 1;
            boolean recoverable = retryable && attempts <= maxRecoveryAttempts;
            return t.withFailure(recoverable ? TaskStatus.PENDING_RETRY : TaskStatus.FAILED, reason, attempts);
        }).orElseThrow(() -> NotFoundException.task(taskId));

        int attempts = updated.recoveryAttempts();
        boolean recoverable = updated.status() == TaskStatus.PENDING_RETRY;
        FailureOutcome outcome = new FailureOutcome(taskId, kind, reason, attempts, recoverable, updated.status());

        if (recoverable) {
            log.warnf("Task %s failed (%s, attempt %d/%d), will retry: %s",
                    taskId, kind, attempts, maxRecoveryAttempts, reason);
        } else {
            log.errorf("Task %s failed terminally (%s, attempt %d/%d): %s",
                    taskId, kind, attempts, maxRecoveryAttempts, reason);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", taskId);
        payload.put("reason", reason);
        payload.put("canRetry", recoverable);
        payload.put("recoveryAttempts", attempts);
        payload.put("kind", kind.name());
        try {
            eventBus.publish(TaskTopics.TASK_FAILED, payload);
        } catch (RuntimeException e) {
            log.errorf(e, "Task %s: failed to publish %s", taskId, TaskTopics.TASK_FAILED);
        }

        AlertSeverity severity = attempts >= maxRecoveryAttempts ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("taskId", taskId);
        attributes.put("reason", reason);
        attributes.put("recoveryAttempts", attempts);
        attributes.put("kind", kind.name());
        alertSink.raise(severity, "Task " + taskId + " failed: " + reason, attributes);

        return outcome;
    }

    public boolean isRetryable(FailureKind kind) {
        return switch (kind) {
            case TIMEOUT -> retryTimeout;
            case NO_WORKERS_AVAILABLE -> retryNoWorkers;
            case CONSENSUS_FAILED -> retryConsensusFailed;
            case PAYMENT_FAILED -> retryPaymentFailed;
            case UNKNOWN -> false;
        };
    }

    public int maxRecoveryAttempts() {
        return maxRecoveryAttempts;
    }

    static String reasonFor(FailureKind kind, Throwable error) {
        if (kind.reason() != null) {
            return kind.reason();
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
