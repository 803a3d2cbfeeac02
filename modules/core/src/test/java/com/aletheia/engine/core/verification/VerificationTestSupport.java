package com.aletheia.engine.core.verification;

import com.aletheia.engine.core.event.EventBus;
import com.aletheia.engine.core.failure.FailureHandler;
import com.aletheia.engine.core.payment.PaymentTrigger;
import com.aletheia.engine.core.service.EngineService;
import com.aletheia.engine.core.task.TaskStore;

public final class VerificationTestSupport {

    private VerificationTestSupport() {
    }

    public static VerificationCollector collector(TaskStore store, EventBus eventBus) {
        VerificationCollector collector = new VerificationCollector();
        collector.store = store;
        collector.eventBus = eventBus;
        return collector;
    }

    public static ResultConsolidator consolidator(TaskStore store, EventBus eventBus, PaymentTrigger payment) {
        ResultConsolidator consolidator = new ResultConsolidator();
        consolidator.store = store;
        consolidator.eventBus = eventBus;
        consolidator.paymentTrigger = payment;
        consolidator.minAgreement = 0;
        return consolidator;
    }

    public static VerificationMonitor monitor(TaskStore store, ResultConsolidator consolidator,
                                              FailureHandler failureHandler, EventBus eventBus,
                                              EngineService engine) {
        VerificationMonitor monitor = new VerificationMonitor();
        monitor.store = store;
        monitor.consolidator = consolidator;
        monitor.failureHandler = failureHandler;
        monitor.eventBus = eventBus;
        monitor.engine = engine;
        monitor.batchSize = 100;
        return monitor;
    }
}
