package com.aletheia.engine.core.task;

import com.aletheia.engine.core.dao.TaskDao;
import com.aletheia.engine.core.dao.TaskRow;
import com.aletheia.engine.core.error.NotFoundException;
import com.aletheia.engine.types.TaskStatus;
import com.aletheia.engine.types.TaskType;
import com.aletheia.engine.types.UrgencyLevel;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * PostgreSQL-backed TaskStore.
 *
 * <p>Compare-and-swap is an {@code UPDATE ... WHERE version = :expected}; the submission
 * append is a single guarded {@code UPDATE} using jsonb containment, so neither relies on
 * row locks held across a read.
 */
@ApplicationScoped
@IfBuildProperty(name = "aletheia.task-store.type", stringValue = "postgres")
public class JdbiTaskStore implements TaskStore {

    private static final Logger log = Logger.getLogger(JdbiTaskStore.class);

    private static final TypeReference<Map<String, Object>> CONTENT = new TypeReference<>() {};
    private static final TypeReference<List<String>> WORKERS = new TypeReference<>() {};
    private static final TypeReference<List<VerificationResult>> SUBMISSIONS = new TypeReference<>() {};
    private static final TypeReference<ConsolidatedResult> CONSOLIDATED = new TypeReference<>() {};

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public Optional<Task> get(String taskId) {
        return jdbi.withExtension(TaskDao.class, dao -> dao.findById(taskId)).map(this::toTask);
    }

    @Override
    public void put(Task task) {
        TaskRow row = toRow(task);
        jdbi.useExtension(TaskDao.class, dao -> dao.upsert(row));
    }

    @Override
    public Optional<Task> compareAndSwap(String taskId, long expectedVersion, UnaryOperator<Task> mutation) {
        Optional<Task> current = get(taskId);
        if (current.isEmpty() || current.get().version() != expectedVersion) {
            return Optional.empty();
        }
        Task next = mutation.apply(current.get()).touched(expectedVersion + 1, Instant.now());
        TaskRow row = toRow(next);
        int written = jdbi.withExtension(TaskDao.class, dao -> dao.updateIfVersion(row, expectedVersion));
        if (written == 0) {
            log.debugf("Task %s: version %d superseded, write skipped", taskId, expectedVersion);
            return Optional.empty();
        }
        return Optional.of(next);
    }

    @Override
    public Task appendSubmission(String taskId, VerificationResult submission) {
        String workerId = submission.workerId();
        String entry = serialize(List.of(submission));
        String worker = serialize(List.of(workerId));
        String prior = serialize(List.of(Map.of("workerId", workerId)));

        Optional<TaskRow> row = jdbi.withExtension(TaskDao.class, dao -> dao.appendSubmission(
                taskId, entry, worker, prior, Instant.now(), TaskStatus.ASSIGNED, TaskStatus.IN_PROGRESS));
        if (row.isPresent()) {
            return toTask(row.get());
        }

        // Nothing matched: re-read to report which precondition failed
        Task current = get(taskId).orElseThrow(() -> NotFoundException.task(taskId));
        SubmissionRules.check(current, workerId);
        throw new TaskStoreException("Submission from " + workerId + " to task " + taskId
                + " raced a concurrent write and was not stored");
    }

    @Override
    public List<Task> queryByStatus(TaskStatus status, Instant updatedBefore, int limit) {
        List<TaskRow> rows = jdbi.withExtension(TaskDao.class, dao -> updatedBefore == null
                ? dao.findByStatus(status, limit)
                : dao.findByStatusUpdatedBefore(status, updatedBefore, limit));
        return rows.stream().map(this::toTask).toList();
    }

    // -- Row mapping --

    private TaskRow toRow(Task task) {
        return new TaskRow(
                task.id(),
                (short) task.type().id(),
                task.priority(),
                (short) task.urgency().id(),
                serialize(task.content()),
                task.verificationThreshold(),
                task.expiresAt(),
                task.status(),
                task.statusReason(),
                serialize(task.assignedWorkers()),
                serialize(task.submissions()),
                serialize(task.consolidatedResult()),
                task.recoveryAttempts(),
                task.retriedAt(),
                task.failureReason(),
                task.createdAt(),
                task.updatedAt(),
                task.version());
    }

    private Task toTask(TaskRow row) {
        return new Task(
                row.id(),
                TaskType.fromId(row.type()),
                row.priority(),
                UrgencyLevel.fromId(row.urgency()),
                deserialize(row.content(), CONTENT),
                row.verificationThreshold(),
                row.expiresAt(),
                row.status(),
                row.statusReason(),
                deserialize(row.assignedWorkers(), WORKERS),
                deserialize(row.submissions(), SUBMISSIONS),
                deserialize(row.consolidatedResult(), CONSOLIDATED),
                row.recoveryAttempts(),
                row.retriedAt(),
                row.failureReason(),
                row.createdAt(),
                row.updatedAt(),
                row.version());
    }

    private String serialize(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new TaskStoreException("Failed to serialize: " + value, e);
        }
    }

    private <T> T deserialize(String json, TypeReference<T> type) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            throw new TaskStoreException("Failed to deserialize task column: " + json, e);
        }
    }
}
