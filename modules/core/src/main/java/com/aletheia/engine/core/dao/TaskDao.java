package com.aletheia.engine.core.dao;

import com.aletheia.engine.types.TaskStatus;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * SQL for {@code verification_task}. Status columns rely on {@link TaskStatusColumn},
 * registered globally by the Jdbi producer.
 */
@RegisterConstructorMapper(TaskRow.class)
public interface TaskDao {

    @SqlQuery("SELECT * FROM verification_task WHERE id = :id")
    Optional<TaskRow> findById(@Bind("id") String id);

    @SqlUpdate("INSERT INTO verification_task (id, type, priority, urgency, content, " +
            "verification_threshold, expires_at, status, status_reason, assigned_workers, submissions, " +
            "consolidated_result, recovery_attempts, retried_at, failure_reason, created_at, updated_at, version) " +
            "VALUES (:t.id, :t.type, :t.priority, :t.urgency, CAST(:t.content AS jsonb), " +
            ":t.verificationThreshold, :t.expiresAt, :t.status, :t.statusReason, " +
            "CAST(:t.assignedWorkers AS jsonb), CAST(:t.submissions AS jsonb), " +
            "CAST(:t.consolidatedResult AS jsonb), :t.recoveryAttempts, :t.retriedAt, :t.failureReason, " +
            ":t.createdAt, :t.updatedAt, :t.version) " +
            "ON CONFLICT (id) DO UPDATE SET type = EXCLUDED.type, priority = EXCLUDED.priority, " +
            "urgency = EXCLUDED.urgency, content = EXCLUDED.content, " +
            "verification_threshold = EXCLUDED.verification_threshold, expires_at = EXCLUDED.expires_at, " +
            "status = EXCLUDED.status, status_reason = EXCLUDED.status_reason, " +
            "assigned_workers = EXCLUDED.assigned_workers, submissions = EXCLUDED.submissions, " +
            "consolidated_result = EXCLUDED.consolidated_result, recovery_attempts = EXCLUDED.recovery_attempts, " +
            "retried_at = EXCLUDED.retried_at, failure_reason = EXCLUDED.failure_reason, " +
            "created_at = EXCLUDED.created_at, updated_at = EXCLUDED.updated_at, version = EXCLUDED.version")
    void upsert(@BindMethods("t") TaskRow row);

    /**
     * Writes every mutable column of {@code row} if the stored version is still
     * {@code expectedVersion}. Returns the number of rows written (0 or 1).
     */
    @SqlUpdate("UPDATE verification_task SET priority = :t.priority, status = :t.status, " +
            "status_reason = :t.statusReason, assigned_workers = CAST(:t.assignedWorkers AS jsonb), " +
            "submissions = CAST(:t.submissions AS jsonb), " +
            "consolidated_result = CAST(:t.consolidatedResult AS jsonb), " +
            "recovery_attempts = :t.recoveryAttempts, retried_at = :t.retriedAt, " +
            "failure_reason = :t.failureReason, updated_at = :t.updatedAt, version = :t.version " +
            "WHERE id = :t.id AND version = :expectedVersion")
    int updateIfVersion(@BindMethods("t") TaskRow row, @Bind("expectedVersion") long expectedVersion);

    /**
     * Appends one submission in a single statement. The WHERE clause carries every
     * precondition, so an empty result means one of them failed.
     */
    @SqlQuery("UPDATE verification_task " +
            "SET submissions = submissions || CAST(:entry AS jsonb), " +
            "status = CASE WHEN status = :assigned THEN :inProgress ELSE status END, " +
            "version = version + 1, updated_at = :now " +
            "WHERE id = :id " +
            "AND status IN (:assigned, :inProgress) " +
            "AND assigned_workers @> CAST(:worker AS jsonb) " +
            "AND NOT (submissions @> CAST(:priorSubmission AS jsonb)) " +
            "RETURNING *")
    Optional<TaskRow> appendSubmission(@Bind("id") String id,
                                       @Bind("entry") String entryJson,
                                       @Bind("worker") String workerJson,
                                       @Bind("priorSubmission") String priorSubmissionJson,
                                       @Bind("now") Instant now,
                                       @Bind("assigned") TaskStatus assigned,
                                       @Bind("inProgress") TaskStatus inProgress);

    @SqlQuery("SELECT * FROM verification_task WHERE status = :status " +
            "ORDER BY updated_at, created_at, id LIMIT :limit")
    List<TaskRow> findByStatus(@Bind("status") TaskStatus status, @Bind("limit") int limit);

    @SqlQuery("SELECT * FROM verification_task WHERE status = :status AND updated_at < :before " +
            "ORDER BY updated_at, created_at, id LIMIT :limit")
    List<TaskRow> findByStatusUpdatedBefore(@Bind("status") TaskStatus status,
                                            @Bind("before") Instant before,
                                            @Bind("limit") int limit);

    @SqlQuery("SELECT status, COUNT(*) AS tasks FROM verification_task GROUP BY status ORDER BY status")
    @RegisterConstructorMapper(StatusCount.class)
    List<StatusCount> countByStatus();
}
