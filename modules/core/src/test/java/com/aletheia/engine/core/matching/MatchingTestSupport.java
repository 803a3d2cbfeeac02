package com.aletheia.engine.core.matching;

import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.failure.FailureHandler;
import com.aletheia.engine.core.fraud.FraudPolicy;
import com.aletheia.engine.core.fraud.FraudRiskScorer;
import com.aletheia.engine.core.task.TaskStore;
import com.aletheia.engine.types.TaskType;

import java.util.Set;

/**
 * Hand-wired matching components for tests.
 */
public final class MatchingTestSupport {

    private MatchingTestSupport() {
    }

    public static WorkerNotifier notifier(WorkerNotificationChannel channel, AcceptanceTracker tracker,
                                          EventBus eventBus, long timeoutSeconds) {
        WorkerNotifier notifier = new WorkerNotifier();
        notifier.channel = channel;
        notifier.tracker = tracker;
        notifier.eventBus = eventBus;
        notifier.timeoutSeconds = timeoutSeconds;
        return notifier;
    }

    public static WorkerMatcher matcher(TaskStore store, WorkerDirectory directory, WorkerNotifier notifier,
                                        AcceptanceTracker tracker, FailureHandler failureHandler, EventBus eventBus) {
        WorkerMatcher matcher = new WorkerMatcher();
        matcher.store = store;
        matcher.directory = directory;
        matcher.fraudScorer = FraudRiskScorer.of(FraudPolicy.defaults());
        matcher.notifier = notifier;
        matcher.tracker = tracker;
        matcher.failureHandler = failureHandler;
        matcher.eventBus = eventBus;
        matcher.maxWorkersPerTask = 10;
        return matcher;
    }

    /** A worker taking any task type, with no activity on record. */
    public static WorkerCandidate worker(String id, double matchScore) {
        return new WorkerCandidate(id, Set.of(), matchScore, null, null);
    }

    public static WorkerCandidate worker(String id, TaskType type, double matchScore) {
        return new WorkerCandidate(id, Set.of(type), matchScore, null, null);
    }
}
