package com.aletheia.engine.core.event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * EventBus that keeps every published event and can be told to fail on given topics.
 */
public class RecordingEventBus implements EventBus {

    private final List<TaskEvent> events = new ArrayList<>();
    private final Set<String> failing = new HashSet<>();

    @Override
    public synchronized void publish(String topic, Map<String, Object> payload) {
        if (failing.contains(topic)) {
            throw new IllegalStateException("Bus unavailable for " + topic);
        }
        events.add(new TaskEvent(topic, payload, Instant.now()));
    }

    public synchronized void failOn(String topic) {
        failing.add(topic);
    }

    public synchronized List<TaskEvent> events() {
        return List.copyOf(events);
    }

    public synchronized List<TaskEvent> ofTopic(String topic) {
        return events.stream().filter(e -> e.is(topic)).toList();
    }

    public synchronized List<String> topics() {
        return events.stream().map(TaskEvent::topic).toList();
    }
}
