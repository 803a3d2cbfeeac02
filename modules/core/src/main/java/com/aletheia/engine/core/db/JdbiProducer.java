package com.aletheia.engine.core.db;

import com.aletheia.engine.core.dao.TaskStatusColumn;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agroal.api.AgroalDataSource;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.jackson2.Jackson2Config;
import org.jdbi.v3.jackson2.Jackson2Plugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

/**
 * The one {@link Jdbi} of the PostgreSQL task store. Task status codes are registered
 * here so every DAO binds and maps them the same way, and jsonb goes through the
 * application's {@link ObjectMapper}.
 */
@ApplicationScoped
@IfBuildProperty(name = "aletheia.task-store.type", stringValue = "postgres")
public class JdbiProducer {

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource, ObjectMapper objectMapper) {
        Jdbi jdbi = Jdbi.create(dataSource)
                .installPlugin(new PostgresPlugin())
                .installPlugin(new SqlObjectPlugin())
                .installPlugin(new Jackson2Plugin())
                .registerColumnMapper(new TaskStatusColumn.Mapper())
                .registerArgument(new TaskStatusColumn.Binder())
                .setSqlLogger(new Slf4JSqlLogger());
        jdbi.getConfig(Jackson2Config.class).setMapper(objectMapper);
        return jdbi;
    }
}
