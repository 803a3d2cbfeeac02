package com.aletheia.engine.core.task;

import com.aletheia.engine.core.error.TaskStateConflictException;
import com.aletheia.engine.core.error.ValidationException;

/**
 * Checks shared by the store implementations when appending a submission.
 */
final class SubmissionRules {

    private SubmissionRules() {
    }

    static void check(Task task, String workerId) {
        if (!task.status().acceptsSubmissions()) {
            throw new TaskStateConflictException(task.id(), task.status(),
                    "Task " + task.id() + " is not accepting submissions (status=" + task.status() + ")");
        }
        if (!task.assignedWorkers().contains(workerId)) {
            throw new ValidationException("Worker " + workerId + " is not assigned to task " + task.id());
        }
        if (task.hasSubmissionFrom(workerId)) {
            throw new ValidationException("Duplicate submission: worker " + workerId
                    + " already submitted for task " + task.id());
        }
    }
}
