package com.aletheia.engine.core.health;

import com.aletheia.engine.core.dao.StatusCount;
import com.aletheia.engine.core.dao.TaskDao;
import com.aletheia.engine.core.db.DatabaseService;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Locale;

/**
 * Ready when the task-store database answers. Reports the number of tasks per status.
 */
@Readiness
@ApplicationScoped
@IfBuildProperty(name = "aletheia.task-store.type", stringValue = "postgres")
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    DatabaseService database;

    @Inject
    Jdbi jdbi;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("task-store");
        if (!database.ping()) {
            return builder.down()
                    .withData("error", database.lastFailure().orElse("unreachable"))
                    .build();
        }
        builder.up().withData("postgres", String.valueOf(database.pgVersion()));
        try {
            List<StatusCount> counts = jdbi.withExtension(TaskDao.class, TaskDao::countByStatus);
            for (StatusCount c : counts) {
                builder.withData(c.status().name().toLowerCase(Locale.ROOT), c.tasks());
            }
        } catch (RuntimeException e) {
            builder.down().withData("error", String.valueOf(e.getMessage()));
        }
        return builder.build();
    }
}
