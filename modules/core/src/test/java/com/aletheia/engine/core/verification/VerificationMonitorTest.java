package com.aletheia.engine.core.verification;

import com.aletheia.engine.core.error.FailureKind;
import com.aletheia.engine.core.event.RecordingEventBus;
import com.aletheia.engine.core.event.TaskEvent;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.failure.FailureTestSupport;
import com.aletheia.engine.core.failure.RecordingAlertSink;
import com.aletheia.engine.core.payment.RecordingPaymentTrigger;
import com.aletheia.engine.core.task.InMemoryTaskStore;
import com.aletheia.engine.core.task.Task;
import com.aletheia.engine.types.TaskStatus;
import com.aletheia.engine.types.TaskType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.aletheia.engine.core.task.TaskFixtures.*;
import static org.assertj.core.api.Assertions.*;

class VerificationMonitorTest {

    InMemoryTaskStore store;
    RecordingEventBus bus;
    RecordingPaymentTrigger payment;
    RecordingAlertSink alerts;
    VerificationMonitor monitor;

    @BeforeEach
    void setUp() {
        store = new InMemoryTaskStore();
        bus = new RecordingEventBus();
        payment = new RecordingPaymentTrigger();
        alerts = new RecordingAlertSink();
        monitor = VerificationTestSupport.monitor(store,
                VerificationTestSupport.consolidator(store, bus, payment),
                FailureTestSupport.handler(store, bus, alerts),
                bus, runningEngine());
    }

    private void withSubmissions(String taskId, int threshold, String... workers) {
        store.put(assigned(taskId, threshold, workers));
        for (String w : workers) {
            store.appendSubmission(taskId, submission(w, "APPROVED"));
        }
    }

    @Test
    void expiredTaskWithQuorum_isFailedNotCompleted() {
        withSubmissions("T4", 3, "a", "b", "c");

        ProgressReport report = monitor.checkProgress("T4", new VerificationRequirements(3),
                Instant.now().minusSeconds(1));

        assertThat(report.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(report.statusReason()).isEqualTo("Task expired");
        assertThat(report.completedVerifications()).isEqualTo(3);
        assertThat(payment.paidTaskIds()).isEmpty();
        List<TaskEvent> failed = bus.ofTopic(TaskTopics.TASK_FAILED);
        assertThat(failed).singleElement().satisfies(e -> assertThat(e.payload()).containsEntry("canRetry", false));
    }

    @Test
    void quorumReached_consolidates() {
        withSubmissions("t", 2, "a", "b");

        ProgressReport report = monitor.checkProgress("t");

        assertThat(report.status()).isEqualTo(TaskStatus.VERIFICATION_COMPLETE);
        assertThat(store.get("t").orElseThrow().consolidatedResult().result()).isEqualTo("APPROVED");
        assertThat(payment.paidTaskIds()).containsExactly("t");
    }

    @Test
    void rosterTooSmall_failsAndIsHandedToFailureHandler() {
        store.put(assigned("t", 3, "a", "b"));

        ProgressReport report = monitor.checkProgress("t");

        Task task = store.get("t").orElseThrow();
        assertThat(report.status()).isEqualTo(TaskStatus.PENDING_RETRY);
        assertThat(task.failureReason()).isEqualTo(FailureKind.NO_WORKERS_AVAILABLE.reason());
        assertThat(task.recoveryAttempts()).isEqualTo(1);
        assertThat(bus.ofTopic(TaskTopics.TASK_FAILED)).hasSize(2);
        assertThat(alerts.alerts()).hasSize(1);
    }

    @Test
    void stillWaiting_leavesTaskUnchanged() {
        store.put(assigned("t", 2, "a", "b", "c"));
        store.appendSubmission("t", submission("a", "APPROVED"));
        Task before = store.get("t").orElseThrow();

        ProgressReport report = monitor.checkProgress("t");

        assertThat(report.status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(report.completedVerifications()).isEqualTo(1);
        assertThat(report.assignedWorkers()).isEqualTo(3);
        assertThat(store.get("t").orElseThrow().version()).isEqualTo(before.version());
    }

    @Test
    void pendingTask_isOnlyCheckedForExpiry() {
        store.put(pending("p", 3));

        assertThat(monitor.checkProgress("p").status()).isEqualTo(TaskStatus.PENDING);

        Task expired = Task.create("late", TaskType.DATA_VERIFICATION, 1, null, Map.of(), 2,
                Instant.now().minusSeconds(10));
        store.put(expired);
        assertThat(monitor.checkProgress("late").status()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    void settledTasks_areReportedAsIs() {
        withSubmissions("done", 1, "a");
        monitor.checkProgress("done");
        long version = store.get("done").orElseThrow().version();

        ProgressReport report = monitor.checkProgress("done", new VerificationRequirements(1),
                Instant.now().minusSeconds(60));

        assertThat(report.status()).isEqualTo(TaskStatus.VERIFICATION_COMPLETE);
        assertThat(store.get("done").orElseThrow().version()).isEqualTo(version);
    }

    @Test
    void paymentFailure_isClassifiedAndTerminalByDefault() {
        payment.setFailing(true);
        withSubmissions("pay", 2, "a", "b");

        ProgressReport report = monitor.checkProgress("pay");

        assertThat(report.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(store.get("pay").orElseThrow().failureReason()).isEqualTo("Payment processing failed");
    }

    @Test
    void checkAll_sweepsEveryInFlightTask() {
        withSubmissions("ready", 1, "a");
        store.put(assigned("short", 3, "a"));
        store.put(assigned("waiting", 1, "a", "b"));

        int changed = monitor.checkAll();

        assertThat(changed).isEqualTo(2);
        assertThat(store.get("ready").orElseThrow().status()).isEqualTo(TaskStatus.VERIFICATION_COMPLETE);
        assertThat(store.get("short").orElseThrow().status()).isEqualTo(TaskStatus.PENDING_RETRY);
        assertThat(store.get("waiting").orElseThrow().status()).isEqualTo(TaskStatus.ASSIGNED);
    }
}
