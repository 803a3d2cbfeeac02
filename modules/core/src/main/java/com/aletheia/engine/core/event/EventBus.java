package com.aletheia.engine.core.event;

import java.util.Map;

/**
 * Publishes lifecycle events. Delivery is at-least-once; consumers must be idempotent.
 */
public interface EventBus {

    /**
     * @throws RuntimeException if the event could not be handed to the bus
     */
    void publish(String topic, Map<String, Object> payload);
}
