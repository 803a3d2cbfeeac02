package com.aletheia.engine.core.task;

import com.aletheia.engine.core.error.NotFoundException;
import com.aletheia.engine.core.error.ValidationException;
import com.aletheia.engine.types.UrgencyLevel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.UUID;

/**
 * Intake and lookup. Stands in for the external intake process that creates PENDING tasks.
 */
@ApplicationScoped
public class TaskService {

    private static final Logger log = Logger.getLogger(TaskService.class);

    @Inject
    TaskStore store;

    @ConfigProperty(name = "aletheia.tasks.default-verification-threshold", defaultValue = "3")
    int defaultVerificationThreshold;

    /**
     * @throws ValidationException for a missing type, a threshold below 1, a deadline in the past
     *         or an id that is already taken
     */
    public Task create(NewTask request) {
        if (request == null || request.type() == null) {
            throw new ValidationException("Missing required field: type");
        }
        int threshold = request.verificationThreshold() != null
                ? request.verificationThreshold()
                : defaultVerificationThreshold;
        if (threshold < 1) {
            throw new ValidationException("verificationThreshold must be >= 1, got: " + threshold);
        }
        if (request.expiresAt() != null && request.expiresAt().isBefore(Instant.now())) {
            throw new ValidationException("expiresAt is in the past: " + request.expiresAt());
        }
        String id = request.id() == null || request.id().isBlank()
                ? UUID.randomUUID().toString()
                : request.id();
        if (store.get(id).isPresent()) {
            throw new ValidationException("Task already exists: " + id);
        }

        Task task = Task.create(id, request.type(),
                request.priority() != null ? request.priority() : 1,
                request.urgency() != null ? request.urgency() : UrgencyLevel.MEDIUM,
                request.content(), threshold, request.expiresAt());
        store.put(task);
        log.infof("Task %s created (type=%s, priority=%d, threshold=%d)",
                id, task.type(), task.priority(), threshold);
        return task;
    }

    /**
     * @throws NotFoundException if absent
     */
    public Task get(String taskId) {
        return store.get(taskId).orElseThrow(() -> NotFoundException.task(taskId));
    }
}
