package com.aletheia.engine.core.failure;

import com.aletheia.engine.core.error.ConsensusFailedException;
import com.aletheia.engine.core.error.FailureKind;
import com.aletheia.engine.core.error.NoWorkersAvailableException;
import com.aletheia.engine.core.error.NotFoundException;
import com.aletheia.engine.core.error.PaymentProcessingException;
import com.aletheia.engine.core.error.TaskTimeoutException;
import com.aletheia.engine.core.event.RecordingEventBus;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.task.InMemoryTaskStore;
import com.aletheia.engine.core.task.Task;
import com.aletheia.engine.types.AlertSeverity;
import com.aletheia.engine.types.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.aletheia.engine.core.task.TaskFixtures.*;
import static org.assertj.core.api.Assertions.*;

class FailureHandlerTest {

    InMemoryTaskStore store;
    RecordingEventBus bus;
    RecordingAlertSink alerts;
    FailureHandler handler;

    @BeforeEach
    void setUp() {
        store = new InMemoryTaskStore();
        bus = new RecordingEventBus();
        alerts = new RecordingAlertSink();
        handler = FailureTestSupport.handler(store, bus, alerts);
    }

    @Test
    void retryableKind_goesToPendingRetry() {
        store.put(pending("t", 2));

        FailureOutcome outcome = handler.handleFailure("t", new TaskTimeoutException("t", "nobody answered"));

        assertThat(outcome.kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(outcome.failureReason()).isEqualTo("Task execution timed out");
        assertThat(outcome.recoveryAttempts()).isEqualTo(1);
        assertThat(outcome.isRecoverable()).isTrue();
        Task task = store.get("t").orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.PENDING_RETRY);
        assertThat(task.statusReason()).isEqualTo("Task execution timed out");
        assertThat(bus.ofTopic(TaskTopics.TASK_FAILED)).singleElement()
                .satisfies(e -> assertThat(e.payload())
                        .containsEntry("canRetry", true)
                        .containsEntry("recoveryAttempts", 1)
                        .containsEntry("kind", "TIMEOUT"));
        assertThat(alerts.last().severity()).isEqualTo(AlertSeverity.MEDIUM);
    }

    @Test
    void retriesExactlyMaxTimesThenFailsTerminally() {
        store.put(pending("t", 2));

        for (int attempt = 1; attempt <= 3; attempt++) {
            FailureOutcome outcome = handler.handleFailure("t", new NoWorkersAvailableException("t", "none"));
            assertThat(outcome.isRecoverable()).as("attempt %d", attempt).isTrue();
        }
        FailureOutcome fourth = handler.handleFailure("t", new NoWorkersAvailableException("t", "none"));

        assertThat(fourth.isRecoverable()).isFalse();
        assertThat(fourth.recoveryAttempts()).isEqualTo(4);
        assertThat(store.get("t").orElseThrow().status()).isEqualTo(TaskStatus.FAILED);
        assertThat(alerts.last().severity()).isEqualTo(AlertSeverity.HIGH);
    }

    @Test
    void alertEscalatesOnceAttemptsReachTheMaximum() {
        store.put(pending("t", 2));

        handler.handleFailure("t", new ConsensusFailedException("t", "split"));
        handler.handleFailure("t", new ConsensusFailedException("t", "split"));
        handler.handleFailure("t", new ConsensusFailedException("t", "split"));

        assertThat(alerts.alerts()).extracting(RecordingAlertSink.Alert::severity)
                .containsExactly(AlertSeverity.MEDIUM, AlertSeverity.MEDIUM, AlertSeverity.HIGH);
        assertThat(store.get("t").orElseThrow().status()).isEqualTo(TaskStatus.PENDING_RETRY);
    }

    @Test
    void paymentFailureOnThirdAttempt_isTerminalWithHighAlert() {
        store.put(pending("T6", 2).withFailure(TaskStatus.PENDING, "earlier", 2));

        FailureOutcome outcome = handler.handleFailure("T6", new PaymentProcessingException("T6", "gateway down"));

        assertThat(outcome.recoveryAttempts()).isEqualTo(3);
        assertThat(outcome.isRecoverable()).isFalse();
        assertThat(outcome.failureReason()).isEqualTo("Payment processing failed");
        assertThat(store.get("T6").orElseThrow().status()).isEqualTo(TaskStatus.FAILED);
        assertThat(alerts.last().severity()).isEqualTo(AlertSeverity.HIGH);
        assertThat(alerts.last().attributes()).containsEntry("taskId", "T6");
    }

    @Test
    void unknownErrors_areNeverRetried() {
        store.put(pending("t", 2));

        FailureOutcome outcome = handler.handleFailure("t", new IllegalStateException("disk on fire"));

        assertThat(outcome.kind()).isEqualTo(FailureKind.UNKNOWN);
        assertThat(outcome.failureReason()).isEqualTo("disk on fire");
        assertThat(outcome.isRecoverable()).isFalse();
        assertThat(store.get("t").orElseThrow().status()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    void terminalFailureBeforeTheMaximum_keepsMediumSeverity() {
        store.put(pending("t", 2));

        FailureOutcome outcome = handler.handleFailure("t", new IllegalStateException("disk on fire"));

        assertThat(outcome.isRecoverable()).isFalse();
        assertThat(outcome.recoveryAttempts()).isEqualTo(1);
        assertThat(alerts.last().severity()).isEqualTo(AlertSeverity.MEDIUM);
        assertThat(alerts.last().attributes()).containsEntry("kind", "UNKNOWN");
    }

    @Test
    void unknownErrorWithoutMessage_usesTheExceptionName() {
        store.put(pending("t", 2));

        assertThat(handler.handleFailure("t", new NullPointerException()).failureReason())
                .isEqualTo("NullPointerException");
    }

    @Test
    void retryFlagsAreConfigurable() {
        handler.retryPaymentFailed = true;
        handler.retryTimeout = false;

        assertThat(handler.isRetryable(FailureKind.PAYMENT_FAILED)).isTrue();
        assertThat(handler.isRetryable(FailureKind.TIMEOUT)).isFalse();
        assertThat(handler.isRetryable(FailureKind.UNKNOWN)).isFalse();
    }

    @Test
    void missingTask_isNotFound() {
        assertThatThrownBy(() -> handler.handleFailure("ghost", new TaskTimeoutException("ghost", "x")))
                .isInstanceOf(NotFoundException.class);
        assertThat(alerts.alerts()).isEmpty();
    }
}
