package com.aletheia.engine.core.dao;

import com.aletheia.engine.types.TaskStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * Row shape of {@code verification_task}. List and map columns are jsonb, carried as
 * JSON text and converted by the store.
 */
public record TaskRow(
        @ColumnName("id") String id,
        @ColumnName("type") short type,
        @ColumnName("priority") int priority,
        @ColumnName("urgency") short urgency,
        @ColumnName("content") String content,
        @ColumnName("verification_threshold") int verificationThreshold,
        @ColumnName("expires_at") Instant expiresAt,
        @ColumnName("status") TaskStatus status,
        @ColumnName("status_reason") String statusReason,
        @ColumnName("assigned_workers") String assignedWorkers,
        @ColumnName("submissions") String submissions,
        @ColumnName("consolidated_result") String consolidatedResult,
        @ColumnName("recovery_attempts") int recoveryAttempts,
        @ColumnName("retried_at") Instant retriedAt,
        @ColumnName("failure_reason") String failureReason,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt,
        @ColumnName("version") long version
) {}
