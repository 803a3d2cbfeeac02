package com.aletheia.engine.core.task;

import com.aletheia.engine.types.TaskStatus;
import com.aletheia.engine.types.TaskType;
import com.aletheia.engine.types.UrgencyLevel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A human-verification task and everything the engine tracks about it.
 *
 * <p>Immutable. Changes go through the {@code with*} methods and are persisted by a
 * {@link TaskStore}, which owns {@code version} and {@code updatedAt}.
 * {@code assignedWorkers} is kept distinct in insertion order and {@code submissions}
 * holds at most one entry per worker.
 */
public record Task(
        String id,
        TaskType type,
        int priority,
        UrgencyLevel urgency,
        Map<String, Object> content,
        int verificationThreshold,
        Instant expiresAt,
        TaskStatus status,
        String statusReason,
        List<String> assignedWorkers,
        List<VerificationResult> submissions,
        ConsolidatedResult consolidatedResult,
        int recoveryAttempts,
        Instant retriedAt,
        String failureReason,
        Instant createdAt,
        Instant updatedAt,
        long version
) {
    public Task {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        if (verificationThreshold < 1) {
            throw new IllegalArgumentException("verificationThreshold must be >= 1, got: " + verificationThreshold);
        }
        urgency = urgency == null ? UrgencyLevel.MEDIUM : urgency;
        content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
        assignedWorkers = assignedWorkers == null
                ? List.of()
                : List.copyOf(new LinkedHashSet<>(assignedWorkers));
        submissions = submissions == null ? List.of() : List.copyOf(submissions);
    }

    public static Task create(String id, TaskType type, int priority, UrgencyLevel urgency,
                              Map<String, Object> content, int verificationThreshold, Instant expiresAt) {
        Instant now = Instant.now();
        return new Task(id, type, priority, urgency, content, verificationThreshold, expiresAt,
                TaskStatus.PENDING, null, List.of(), List.of(), null,
                0, null, null, now, now, 0L);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    public boolean hasSubmissionFrom(String workerId) {
        for (VerificationResult s : submissions) {
            if (s.workerId().equals(workerId)) return true;
        }
        return false;
    }

    public Task withStatus(TaskStatus newStatus, String reason) {
        return new Task(id, type, priority, urgency, content, verificationThreshold, expiresAt,
                newStatus, reason, assignedWorkers, submissions, consolidatedResult,
                recoveryAttempts, retriedAt, failureReason, createdAt, updatedAt, version);
    }

    /** Moves to ASSIGNED with {@code workers} merged into the existing roster. */
    public Task withAssignment(List<String> workers) {
        List<String> roster = new ArrayList<>(assignedWorkers);
        roster.addAll(workers);
        return new Task(id, type, priority, urgency, content, verificationThreshold, expiresAt,
                TaskStatus.ASSIGNED, null, roster, submissions, consolidatedResult,
                recoveryAttempts, retriedAt, failureReason, createdAt, updatedAt, version);
    }

    /** Appends a submission; the first one moves an ASSIGNED task to IN_PROGRESS. */
    public Task withSubmission(VerificationResult submission) {
        List<VerificationResult> next = new ArrayList<>(submissions);
        next.add(submission);
        TaskStatus nextStatus = status == TaskStatus.ASSIGNED ? TaskStatus.IN_PROGRESS : status;
        return new Task(id, type, priority, urgency, content, verificationThreshold, expiresAt,
                nextStatus, statusReason, assignedWorkers, next, consolidatedResult,
                recoveryAttempts, retriedAt, failureReason, createdAt, updatedAt, version);
    }

    public Task withConsolidatedResult(ConsolidatedResult result) {
        return new Task(id, type, priority, urgency, content, verificationThreshold, expiresAt,
                TaskStatus.VERIFICATION_COMPLETE, null, assignedWorkers, submissions, result,
                recoveryAttempts, retriedAt, failureReason, createdAt, updatedAt, version);
    }

    /** Back to PENDING after a stall, counting it as a recovery attempt. */
    public Task requeued(Instant at, String reason) {
        return new Task(id, type, priority, urgency, content, verificationThreshold, expiresAt,
                TaskStatus.PENDING, reason, assignedWorkers, submissions, consolidatedResult,
                recoveryAttempts + 1, at, failureReason, createdAt, updatedAt, version);
    }

    /** Records a classified failure; {@code newStatus} is FAILED or PENDING_RETRY. */
    public Task withFailure(TaskStatus newStatus, String reason, int attempts) {
        return new Task(id, type, priority, urgency, content, verificationThreshold, expiresAt,
                newStatus, reason, assignedWorkers, submissions, consolidatedResult,
                attempts, retriedAt, reason, createdAt, updatedAt, version);
    }

    public Task withRetriedAt(Instant at) {
        return new Task(id, type, priority, urgency, content, verificationThreshold, expiresAt,
                status, statusReason, assignedWorkers, submissions, consolidatedResult,
                recoveryAttempts, at, failureReason, createdAt, updatedAt, version);
    }

    /** Stamped by the store on every successful write. */
    public Task touched(long newVersion, Instant at) {
        return new Task(id, type, priority, urgency, content, verificationThreshold, expiresAt,
                status, statusReason, assignedWorkers, submissions, consolidatedResult,
                recoveryAttempts, retriedAt, failureReason, createdAt, at, newVersion);
    }

    /** Same task with a different last-update time, version unchanged. */
    public Task withUpdatedAt(Instant at) {
        return touched(version, at);
    }
}
