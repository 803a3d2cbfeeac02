package com.aletheia.engine.core.matching;

import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.types.DistributionStrategy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Offers a task to a set of workers and waits, at most
 * {@code aletheia.notification.timeout-seconds}, for their answers. Workers who do not
 * answer in time are left out. No task-store state is held while waiting.
 */
@ApplicationScoped
public class WorkerNotifier {

    private static final Logger log = Logger.getLogger(WorkerNotifier.class);

    @Inject
    WorkerNotificationChannel channel;

    @Inject
    AcceptanceTracker tracker;

    @Inject
    EventBus eventBus;

    @ConfigProperty(name = "aletheia.notification.timeout-seconds", defaultValue = "30")
    long timeoutSeconds;

    public NotificationOutcome notifyEligibleWorkers(String taskId, List<String> eligibleWorkers,
                                                     DistributionStrategy strategy) {
        if (eligibleWorkers.isEmpty()) {
            return new NotificationOutcome(List.of(), List.of());
        }
        Instant expiresAt = Instant.now().plusSeconds(timeoutSeconds);
        AcceptanceTracker.Round round = tracker.open(taskId, eligibleWorkers);
        try {
            List<String> notified = new ArrayList<>(eligibleWorkers.size());
            for (String workerId : eligibleWorkers) {
                try {
                    channel.notify(new WorkerNotification(taskId, workerId, strategy, expiresAt));
                    notified.add(workerId);
                } catch (RuntimeException e) {
                    log.warnf(e, "Could not notify worker %s about task %s", workerId, taskId);
                    round.withdraw(workerId);
                }
            }
            publishNotified(taskId, notified, strategy, expiresAt);

            if (!notified.isEmpty()) {
                boolean everyoneAnswered = round.await(Duration.ofSeconds(timeoutSeconds));
                if (!everyoneAnswered) {
                    log.debugf("Task %s: notification window closed before all workers answered", taskId);
                }
            }
            List<String> accepted = round.accepted();
            log.infof("Task %s: %d of %d notified worker(s) accepted (%s)",
                    taskId, accepted.size(), notified.size(), strategy);
            return new NotificationOutcome(notified, accepted);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warnf("Task %s: interrupted while waiting for acceptances", taskId);
            return new NotificationOutcome(eligibleWorkers, round.accepted());
        } finally {
            tracker.close(round);
        }
    }

    private void publishNotified(String taskId, List<String> notified, DistributionStrategy strategy,
                                 Instant expiresAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", taskId);
        payload.put("workerIds", notified);
        payload.put("strategy", strategy.name());
        payload.put("expiresAt", expiresAt.toString());
        try {
            eventBus.publish(TaskTopics.WORKERS_NOTIFIED, payload);
        } catch (RuntimeException e) {
            log.errorf(e, "Task %s: failed to publish %s", taskId, TaskTopics.WORKERS_NOTIFIED);
        }
    }
}
