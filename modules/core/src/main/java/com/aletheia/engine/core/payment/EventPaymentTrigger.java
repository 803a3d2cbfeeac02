package com.aletheia.engine.core.payment;

import com.aletheia.engine.core.error.PaymentProcessingException;
import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.event.TaskTopics;
import com.aletheia.engine.core.task.ConsolidatedResult;
import com.aletheia.engine.core.task.Task;
import com.aletheia.engine.core.task.VerificationResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requests payment by publishing {@code PaymentRequested}, naming every worker whose
 * submission went into the consolidated result.
 */
@ApplicationScoped
public class EventPaymentTrigger implements PaymentTrigger {

    private static final Logger log = Logger.getLogger(EventPaymentTrigger.class);

    @Inject
    EventBus eventBus;

    @Override
    public void trigger(Task completedTask) {
        ConsolidatedResult result = completedTask.consolidatedResult();
        if (result == null) {
            throw new PaymentProcessingException(completedTask.id(),
                    "Task " + completedTask.id() + " has no consolidated result to pay for");
        }
        List<String> payees = completedTask.submissions().stream()
                .map(VerificationResult::workerId)
                .toList();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", completedTask.id());
        payload.put("workerIds", payees);
        payload.put("result", result.result());
        payload.put("confidence", result.confidence());
        try {
            eventBus.publish(TaskTopics.PAYMENT_REQUESTED, payload);
        } catch (RuntimeException e) {
            throw new PaymentProcessingException(completedTask.id(),
                    "Could not request payment for task " + completedTask.id(), e);
        }
        log.debugf("Payment requested for task %s (%d payees)", completedTask.id(), payees.size());
    }
}
