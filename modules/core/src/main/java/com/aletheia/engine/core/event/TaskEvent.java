package com.aletheia.engine.core.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A published lifecycle event. The payload always carries {@code taskId}.
 */
public record TaskEvent(String topic, Map<String, Object> payload, Instant occurredAt) {

    public TaskEvent {
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public String taskId() {
        Object id = payload.get("taskId");
        return id == null ? null : id.toString();
    }

    public boolean is(String expectedTopic) {
        return topic.equals(expectedTopic);
    }
}
