package com.aletheia.engine.core.event;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.event.NotificationOptions;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * EventBus over CDI events. Synchronous observers (audit) see the event before
 * {@link #publish} returns; asynchronous observers (worker matching) run on the
 * event executor.
 */
@ApplicationScoped
public class CdiEventBus implements EventBus {

    @Inject
    Event<TaskEvent> taskEvent;

    @Inject
    @Named("eventExecutor")
    ExecutorService executor;

    @Override
    public void publish(String topic, Map<String, Object> payload) {
        TaskEvent event = new TaskEvent(topic, payload, Instant.now());
        taskEvent.fire(event);
        taskEvent.fireAsync(event, NotificationOptions.ofExecutor(executor));
    }
}
