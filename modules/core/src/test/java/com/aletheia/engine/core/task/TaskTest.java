package com.aletheia.engine.core.task;

import com.aletheia.engine.types.TaskStatus;
import com.aletheia.engine.types.TaskType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.aletheia.engine.core.task.TaskFixtures.*;
import static org.assertj.core.api.Assertions.*;

class TaskTest {

    @Test
    void create_startsPendingAtVersionZero() {
        Task task = pending("t1", 3);

        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.version()).isZero();
        assertThat(task.recoveryAttempts()).isZero();
        assertThat(task.assignedWorkers()).isEmpty();
    }

    @Test
    void thresholdBelowOne_isRejected() {
        assertThatThrownBy(() -> Task.create("t1", TaskType.CODE_VERIFICATION, 1, null, null, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void assignment_mergesRosterWithoutDuplicates() {
        Task task = assigned("t1", 3, "a", "b").withAssignment(List.of("b", "c"));

        assertThat(task.assignedWorkers()).containsExactly("a", "b", "c");
        assertThat(task.status()).isEqualTo(TaskStatus.ASSIGNED);
    }

    @Test
    void requeued_countsAttemptAndStampsRetry() {
        Instant at = Instant.parse("2026-01-01T00:00:00Z");
        Task task = assigned("t1", 2, "a").withSubmission(submission("a", "X")).requeued(at, "STALLED");

        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.recoveryAttempts()).isEqualTo(1);
        assertThat(task.retriedAt()).isEqualTo(at);
        assertThat(task.submissions()).hasSize(1);
    }

    @Test
    void expiry_isStrict() {
        Instant deadline = Instant.parse("2026-01-01T00:00:00Z");
        Task task = Task.create("t1", TaskType.TEXT_VERIFICATION, 1, null, null, 1, deadline);

        assertThat(task.isExpired(deadline)).isFalse();
        assertThat(task.isExpired(deadline.plusMillis(1))).isTrue();
        Task noDeadline = Task.create("t2", TaskType.TEXT_VERIFICATION, 1, null, null, 1, null);
        assertThat(noDeadline.isExpired(Instant.now())).isFalse();
    }
}
