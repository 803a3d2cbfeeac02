package com.aletheia.engine.core.matching;

import com.aletheia.engine.core.dao.DatabaseDao;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes offers with {@code pg_notify} on {@value #CHANNEL}; the worker gateway
 * LISTENs and forwards them.
 */
@ApplicationScoped
@IfBuildProperty(name = "aletheia.task-store.type", stringValue = "postgres")
public class PgNotifyWorkerChannel implements WorkerNotificationChannel {

    static final String CHANNEL = "worker_notification";

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public void notify(WorkerNotification notification) {
        String payload = toJson(notification);
        jdbi.useExtension(DatabaseDao.class, dao -> dao.notify(CHANNEL, payload));
    }

    String toJson(WorkerNotification notification) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("taskId", notification.taskId());
        body.put("workerId", notification.workerId());
        body.put("strategy", notification.strategy().label());
        body.put("expiresAt", notification.expiresAt().toString());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize notification for task " + notification.taskId(), e);
        }
    }
}
