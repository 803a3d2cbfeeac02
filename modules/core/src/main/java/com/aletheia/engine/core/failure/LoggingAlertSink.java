package com.aletheia.engine.core.failure;

import com.aletheia.engine.types.AlertSeverity;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Alerts as log records on a dedicated category, for a log shipper to route.
 */
@ApplicationScoped
public class LoggingAlertSink implements AlertSink {

    private static final Logger log = Logger.getLogger("com.aletheia.engine.alerts");

    @Override
    public void raise(AlertSeverity severity, String message, Map<String, Object> attributes) {
        if (severity == AlertSeverity.HIGH) {
            log.errorf("ALERT [%s] %s %s", severity.label(), message, attributes);
        } else {
            log.warnf("ALERT [%s] %s %s", severity.label(), message, attributes);
        }
    }
}
