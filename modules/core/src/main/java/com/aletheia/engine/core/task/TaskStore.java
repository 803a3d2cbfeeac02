package com.aletheia.engine.core.task;

import com.aletheia.engine.types.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Durable keyed storage for tasks. The only shared mutable resource of the engine:
 * components coordinate exclusively through the optimistic writes below, never
 * through in-process locks.
 *
 * <p>Every successful write increments {@code version} and stamps {@code updatedAt}.
 */
public interface TaskStore {

    int MAX_UPDATE_ATTEMPTS = 16;

    Optional<Task> get(String taskId);

    /**
     * Inserts or replaces a task exactly as given, including its version and timestamps.
     * Intended for intake; lifecycle changes use {@link #compareAndSwap}.
     */
    void put(Task task);

    /**
     * Applies {@code mutation} only if the stored version still equals {@code expectedVersion}.
     *
     * @return the stored task after the write, or empty if the task is missing or was
     *         changed by someone else since {@code expectedVersion} was read
     * @throws TaskStoreException on persistence errors
     */
    Optional<Task> compareAndSwap(String taskId, long expectedVersion, UnaryOperator<Task> mutation);

    /**
     * Re-reads and retries {@link #compareAndSwap} until the write lands or the
     * precondition stops holding.
     *
     * @return the stored task after the write, or empty if the task is missing or the
     *         precondition is false for its current state
     * @throws TaskStoreException if contention persists past {@link #MAX_UPDATE_ATTEMPTS}
     */
    default Optional<Task> conditionalUpdate(String taskId, Predicate<Task> precondition,
                                             UnaryOperator<Task> mutation) {
        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            Optional<Task> current = get(taskId);
            if (current.isEmpty() || !precondition.test(current.get())) {
                return Optional.empty();
            }
            Optional<Task> updated = compareAndSwap(taskId, current.get().version(), mutation);
            if (updated.isPresent()) {
                return updated;
            }
        }
        throw new TaskStoreException("Gave up updating task " + taskId + " after "
                + MAX_UPDATE_ATTEMPTS + " conflicting writes");
    }

    /**
     * Atomically appends a submission. The store itself enforces that the task accepts
     * submissions, that the worker is on the roster and that the worker has not submitted
     * before, so concurrent submissions from different workers never overwrite each other.
     * The first submission moves an ASSIGNED task to IN_PROGRESS.
     *
     * @throws com.aletheia.engine.core.error.NotFoundException if the task does not exist
     * @throws com.aletheia.engine.core.error.ValidationException for an unassigned or duplicate worker
     * @throws com.aletheia.engine.core.error.TaskStateConflictException if the task is not ASSIGNED or IN_PROGRESS
     */
    Task appendSubmission(String taskId, VerificationResult submission);

    /**
     * Tasks in {@code status}, oldest update first.
     *
     * @param updatedBefore only tasks whose {@code updatedAt} is strictly earlier; null for no bound
     */
    List<Task> queryByStatus(TaskStatus status, Instant updatedBefore, int limit);
}
