package com.aletheia.engine.core.matching;

import com.aletheia.engine.core.error.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Open notification rounds, one per task, collecting worker responses while the
 * {@link WorkerNotifier} waits. Lives in the process that sent the offers.
 */
@ApplicationScoped
public class AcceptanceTracker {

    private static final Logger log = Logger.getLogger(AcceptanceTracker.class);

    private final ConcurrentHashMap<String, Round> rounds = new ConcurrentHashMap<>();

    /**
     * Starts collecting responses from {@code workers} for {@code taskId}.
     *
     * @throws IllegalStateException if a round for the task is already open
     */
    public Round open(String taskId, Collection<String> workers) {
        Round round = new Round(taskId, workers);
        if (rounds.putIfAbsent(taskId, round) != null) {
            throw new IllegalStateException("Notification round already open for task " + taskId);
        }
        return round;
    }

    /**
     * Records a worker's answer.
     *
     * @return false if no round is open for the task
     * @throws ValidationException if the worker was not offered the task
     */
    public boolean respond(String taskId, String workerId, boolean accepted) {
        Round round = rounds.get(taskId);
        if (round == null) {
            return false;
        }
        round.record(workerId, accepted);
        log.debugf("Worker %s %s task %s", workerId, accepted ? "accepted" : "declined", taskId);
        return true;
    }

    public boolean isOpen(String taskId) {
        return rounds.containsKey(taskId);
    }

    public void close(Round round) {
        rounds.remove(round.taskId(), round);
    }

    /** Responses for one task. Each worker's first answer counts. */
    public static final class Round {

        private final String taskId;
        private final Set<String> offered;
        private final Set<String> responded = new LinkedHashSet<>();
        private final Set<String> accepted = new LinkedHashSet<>();
        private final CountDownLatch pending;

        Round(String taskId, Collection<String> workers) {
            this.taskId = taskId;
            this.offered = Set.copyOf(workers);
            this.pending = new CountDownLatch(offered.size());
        }

        public String taskId() {
            return taskId;
        }

        synchronized void record(String workerId, boolean accept) {
            if (!offered.contains(workerId)) {
                throw new ValidationException("Worker " + workerId + " was not offered task " + taskId);
            }
            if (!responded.add(workerId)) {
                return;
            }
            if (accept) {
                accepted.add(workerId);
            }
            pending.countDown();
        }

        /** Counts an offer that never reached the worker as a decline. */
        void withdraw(String workerId) {
            record(workerId, false);
        }

        /**
         * Blocks until every offered worker answered or {@code timeout} elapsed.
         *
         * @return true if everyone answered in time
         */
        public boolean await(Duration timeout) throws InterruptedException {
            return pending.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        /** Accepting workers in the order they answered. */
        public synchronized List<String> accepted() {
            return new ArrayList<>(accepted);
        }
    }
}
