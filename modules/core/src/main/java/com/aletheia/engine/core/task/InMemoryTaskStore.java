package com.aletheia.engine.core.task;

import com.aletheia.engine.core.error.NotFoundException;
import com.aletheia.engine.types.TaskStatus;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Map-backed TaskStore for development and testing.
 *
 * <p>Each write runs inside {@link ConcurrentHashMap#compute}, which is atomic per key,
 * so the version check and the append behave like their SQL counterparts.
 */
@ApplicationScoped
@IfBuildProperty(name = "aletheia.task-store.type", stringValue = "memory")
public class InMemoryTaskStore implements TaskStore {

    private static final Comparator<Task> OLDEST_FIRST = Comparator
            .comparing(Task::updatedAt)
            .thenComparing(Task::createdAt)
            .thenComparing(Task::id);

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public Optional<Task> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public void put(Task task) {
        tasks.put(task.id(), task);
    }

    @Override
    public Optional<Task> compareAndSwap(String taskId, long expectedVersion, UnaryOperator<Task> mutation) {
        Task[] written = new Task[1];
        tasks.computeIfPresent(taskId, (id, current) -> {
            if (current.version() != expectedVersion) {
                return current;
            }
            Task next = mutation.apply(current).touched(current.version() + 1, Instant.now());
            written[0] = next;
            return next;
        });
        return Optional.ofNullable(written[0]);
    }

    @Override
    public Task appendSubmission(String taskId, VerificationResult submission) {
        Task updated = tasks.computeIfPresent(taskId, (id, current) -> {
            SubmissionRules.check(current, submission.workerId());
            return current.withSubmission(submission).touched(current.version() + 1, Instant.now());
        });
        if (updated == null) {
            throw NotFoundException.task(taskId);
        }
        return updated;
    }

    @Override
    public List<Task> queryByStatus(TaskStatus status, Instant updatedBefore, int limit) {
        return tasks.values().stream()
                .filter(t -> t.status() == status)
                .filter(t -> updatedBefore == null || t.updatedAt().isBefore(updatedBefore))
                .sorted(OLDEST_FIRST)
                .limit(limit)
                .toList();
    }
}
