package com.aletheia.engine.core.event;

/**
 * Topic names published on the {@link EventBus}.
 */
public final class TaskTopics {

    public static final String TASK_SCHEDULED = "TaskScheduled";
    public static final String TASK_REQUEUED = "TaskRequeued";
    public static final String WORKERS_NOTIFIED = "WorkersNotified";
    public static final String TASK_ASSIGNED = "TaskAssigned";
    public static final String TASK_SUBMISSION_RECEIVED = "TaskSubmissionReceived";
    public static final String TASK_COMPLETED = "TaskCompleted";
    public static final String CONSOLIDATION_FAILED = "ConsolidationFailed";
    public static final String TASK_RESET = "TaskReset";
    public static final String TASK_FAILED = "TaskFailed";
    public static final String PAYMENT_REQUESTED = "PaymentRequested";

    private TaskTopics() {
    }
}
