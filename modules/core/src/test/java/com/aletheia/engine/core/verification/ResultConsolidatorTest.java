package com.aletheia.engine.core.verification;

import com.aletheia.engine.core.error.ConsensusFailedException;
import com.aletheia.engine.core.error.InsufficientVerificationsException;
import com.aletheia.engine.core.error.PaymentProcessingException;
import com.aletheia.engine.core.event.RecordingEventBus;
import com.aletheia.engine.core.event.TaskEvent;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.payment.RecordingPaymentTrigger;
import com.aletheia.engine.core.task.ConsolidatedResult;
import com.aletheia.engine.core.task.InMemoryTaskStore;
import com.aletheia.engine.core.task.Task;
import com.aletheia.engine.core.task.VerificationResult;
import com.aletheia.engine.types.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

import static com.aletheia.engine.core.task.TaskFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ResultConsolidatorTest {

    InMemoryTaskStore store;
    RecordingEventBus bus;
    RecordingPaymentTrigger payment;
    ResultConsolidator consolidator;

    @BeforeEach
    void setUp() {
        store = new InMemoryTaskStore();
        bus = new RecordingEventBus();
        payment = new RecordingPaymentTrigger();
        consolidator = VerificationTestSupport.consolidator(store, bus, payment);
    }

    private void seed(String taskId, int threshold, Object... results) {
        String[] workers = new String[results.length];
        for (int i = 0; i < results.length; i++) {
            workers[i] = "w" + (char) ('A' + i);
        }
        store.put(assigned(taskId, threshold, workers));
        for (int i = 0; i < results.length; i++) {
            store.appendSubmission(taskId, submission(workers[i], results[i]));
        }
    }

    @Test
    void unanimousSubmissions_completeTheTask() {
        seed("T1", 3, "APPROVED", "APPROVED", "APPROVED");

        ConsolidatedResult result = consolidator.consolidate("T1", 3);

        assertThat(result.result()).isEqualTo("APPROVED");
        assertThat(result.verifierCount()).isEqualTo(3);
        Task task = store.get("T1").orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.VERIFICATION_COMPLETE);
        assertThat(task.consolidatedResult()).isEqualTo(result);
        assertThat(task.submissions()).hasSize(3);
        assertThat(payment.paidTaskIds()).containsExactly("T1");
        List<TaskEvent> completed = bus.ofTopic(TaskTopics.TASK_COMPLETED);
        assertThat(completed).hasSize(1);
        assertThat(completed.get(0).payload()).containsKey("completionDetails");
    }

    @Test
    void majorityWins() {
        seed("T2", 3, "APPROVED", "REJECTED", "APPROVED");

        ConsolidatedResult result = consolidator.consolidate("T2", 3);

        assertThat(result.result()).isEqualTo("APPROVED");
        assertThat(result.agreementCount()).isEqualTo(2);
        assertThat(result.verifierCount()).isEqualTo(3);
    }

    @Test
    void belowThreshold_failsWithoutTouchingTheTask() {
        seed("t", 3, "APPROVED", "APPROVED");
        Task before = store.get("t").orElseThrow();

        assertThatThrownBy(() -> consolidator.consolidate("t", 3))
                .isInstanceOf(InsufficientVerificationsException.class)
                .hasMessageContaining("2 < 3");

        Task after = store.get("t").orElseThrow();
        assertThat(after.status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(after.version()).isEqualTo(before.version());
        assertThat(bus.events()).isEmpty();
        assertThat(payment.paidTaskIds()).isEmpty();
    }

    @Test
    void meansCoverAllSubmissionsNotJustTheMajority() {
        Instant now = Instant.now();
        List<VerificationResult> submissions = List.of(
                new VerificationResult("a", "YES", 1.0, 10, now, Map.of()),
                new VerificationResult("b", "YES", 0.8, 20, now, Map.of()),
                new VerificationResult("c", "NO", 0.3, 60, now, Map.of()));

        ConsolidatedResult result = ResultConsolidator.aggregate(submissions, now);

        assertThat(result.confidence()).isCloseTo(0.7, within(1e-9));
        assertThat(result.averageTimeSpentSeconds()).isCloseTo(30.0, within(1e-9));
    }

    @Test
    void tie_goesToTheGroupWhoseValueAppearedFirst() {
        Instant now = Instant.now();
        List<VerificationResult> submissions = List.of(
                submission("a", "APPROVED"), submission("b", "REJECTED"),
                submission("c", "REJECTED"), submission("d", "APPROVED"));

        for (int run = 0; run < 5; run++) {
            ConsolidatedResult result = ResultConsolidator.aggregate(submissions, now);
            assertThat(result.result()).isEqualTo("APPROVED");
            assertThat(result.agreementCount()).isEqualTo(2);
        }
        List<VerificationResult> reordered = List.of(
                submission("b", "REJECTED"), submission("a", "APPROVED"),
                submission("d", "APPROVED"), submission("c", "REJECTED"));
        assertThat(ResultConsolidator.aggregate(reordered, now).result()).isEqualTo("REJECTED");
    }

    @Test
    void tie_throughTheConsolidatorStoresTheFirstAppearingValue() {
        seed("tie", 4, "APPROVED", "REJECTED", "REJECTED", "APPROVED");

        assertThat(consolidator.consolidate("tie", 4).result()).isEqualTo("APPROVED");
        assertThat(store.get("tie").orElseThrow().consolidatedResult().result()).isEqualTo("APPROVED");
    }

    @Test
    void submissionLandingBeforeTheWrite_isIncludedInTheStoredResult() {
        InMemoryTaskStore racing = new InMemoryTaskStore() {
            private boolean appended;

            @Override
            public Optional<Task> compareAndSwap(String taskId, long expectedVersion, UnaryOperator<Task> mutation) {
                if (!appended) {
                    appended = true;
                    appendSubmission(taskId, submission("wD", "REJECTED"));
                }
                return super.compareAndSwap(taskId, expectedVersion, mutation);
            }
        };
        racing.put(assigned("late", 3, "wA", "wB", "wC", "wD"));
        racing.appendSubmission("late", submission("wA", "APPROVED"));
        racing.appendSubmission("late", submission("wB", "APPROVED"));
        racing.appendSubmission("late", submission("wC", "REJECTED"));
        ResultConsolidator consolidating = VerificationTestSupport.consolidator(racing, bus, payment);

        ConsolidatedResult result = consolidating.consolidate("late", 3);

        Task stored = racing.get("late").orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.VERIFICATION_COMPLETE);
        assertThat(stored.submissions()).hasSize(4);
        assertThat(stored.consolidatedResult().verifierCount()).isEqualTo(4);
        assertThat(result.verifierCount()).isEqualTo(4);
        assertThat(result.agreementCount()).isEqualTo(2);
        assertThat(result.result()).isEqualTo("APPROVED");
        assertThat(payment.paidTaskIds()).containsExactly("late");
    }

    @Test
    void structuredResultsAreGroupedByContent() {
        Instant now = Instant.now();
        List<VerificationResult> submissions = List.of(
                submission("a", Map.of("label", "cat", "score", 3)),
                submission("b", Map.of("score", 3.0, "label", "cat")),
                submission("c", Map.of("label", "dog", "score", 3)));

        ConsolidatedResult result = ResultConsolidator.aggregate(submissions, now);

        assertThat(result.agreementCount()).isEqualTo(2);
        assertThat(result.result()).isEqualTo(Map.of("label", "cat", "score", 3));
    }

    @Test
    void metadata_laterSubmissionsOverwrite() {
        Instant now = Instant.now();
        List<VerificationResult> submissions = List.of(
                new VerificationResult("a", "Y", 1, 1, now, Map.of("lang", "en", "device", "web")),
                new VerificationResult("b", "Y", 1, 1, now, Map.of("lang", "fr")));

        assertThat(ResultConsolidator.aggregate(submissions, now).metadata())
                .containsEntry("lang", "fr")
                .containsEntry("device", "web");
    }

    @Test
    void secondConsolidation_returnsStoredResultAndDoesNotPayAgain() {
        seed("t", 2, "A", "A");

        ConsolidatedResult first = consolidator.consolidate("t", 2);
        ConsolidatedResult second = consolidator.consolidate("t", 2);

        assertThat(second).isEqualTo(first);
        assertThat(payment.paidTaskIds()).containsExactly("t");
        assertThat(bus.ofTopic(TaskTopics.TASK_COMPLETED)).hasSize(1);
    }

    @Test
    void racingConsolidations_payExactlyOnce() throws Exception {
        seed("race", 3, "A", "A", "B");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ConsolidatedResult>> futures = new ArrayList<>();
        Callable<ConsolidatedResult> attempt = () -> {
            start.await();
            return consolidator.consolidate("race", 3);
        };
        for (int i = 0; i < 8; i++) {
            futures.add(pool.submit(attempt));
        }
        start.countDown();
        for (Future<ConsolidatedResult> f : futures) {
            assertThat(f.get(5, TimeUnit.SECONDS).result()).isEqualTo("A");
        }
        pool.shutdown();

        assertThat(payment.paidTaskIds()).containsExactly("race");
        assertThat(store.get("race").orElseThrow().status()).isEqualTo(TaskStatus.VERIFICATION_COMPLETE);
    }

    @Test
    void agreementBelowFloor_marksFailedAndRethrows() {
        consolidator.minAgreement = 0.75;
        seed("split", 3, "A", "B", "A");

        assertThatThrownBy(() -> consolidator.consolidate("split", 3))
                .isInstanceOf(ConsensusFailedException.class);

        Task task = store.get("split").orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.statusReason()).startsWith("Consolidation failed:");
        assertThat(bus.topics()).contains(TaskTopics.CONSOLIDATION_FAILED);
        assertThat(payment.paidTaskIds()).isEmpty();
    }

    @Test
    void paymentFailure_propagatesAfterCompletion() {
        payment.setFailing(true);
        seed("pay", 2, "A", "A");

        assertThatThrownBy(() -> consolidator.consolidate("pay", 2))
                .isInstanceOf(PaymentProcessingException.class);

        assertThat(store.get("pay").orElseThrow().status()).isEqualTo(TaskStatus.VERIFICATION_COMPLETE);
    }
}
