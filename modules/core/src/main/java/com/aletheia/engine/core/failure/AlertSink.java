package com.aletheia.engine.core.failure;

import com.aletheia.engine.types.AlertSeverity;

import java.util.Map;

/**
 * Operator alerting.
 */
public interface AlertSink {

    void raise(AlertSeverity severity, String message, Map<String, Object> attributes);
}
