package com.aletheia.engine.core.error;

/**
 * The payment trigger rejected a completed task.
 */
public class PaymentProcessingException extends TaskFailureException {

    public PaymentProcessingException(String taskId, String message) {
        super(taskId, message);
    }

    public PaymentProcessingException(String taskId, String message, Throwable cause) {
        super(taskId, message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.PAYMENT_FAILED;
    }
}
