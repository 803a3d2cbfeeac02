package com.aletheia.engine.core.payment;

import com.aletheia.engine.core.error.PaymentProcessingException;
import com.aletheia.engine.core.task.Task;

/**
 * Hands a completed task to the payment subsystem. Called once per successful
 * transition to VERIFICATION_COMPLETE.
 */
public interface PaymentTrigger {

    /**
     * @throws PaymentProcessingException if the payment subsystem did not take the task
     */
    void trigger(Task completedTask);
}
