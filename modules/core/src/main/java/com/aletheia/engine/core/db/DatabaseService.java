package com.aletheia.engine.core.db;

import com.aletheia.engine.core.dao.DatabaseDao;
import com.aletheia.engine.core.service.AbstractManagedService;
import io.quarkus.arc.properties.IfBuildProperty;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

/**
 * PostgreSQL behind the task store. Starts at boot and refuses to run until the server
 * answers and the {@value #TASK_TABLE} table exists, so the engine never sweeps an
 * unmigrated schema.
 */
@ApplicationScoped
@Startup
@IfBuildProperty(name = "aletheia.task-store.type", stringValue = "postgres")
public class DatabaseService extends AbstractManagedService {

    static final String TASK_TABLE = "verification_task";

    @Inject
    Jdbi jdbi;

    private volatile String pgVersion;

    @Override
    public String serviceId() {
        return "database";
    }

    @Override
    protected void doStart() {
        jdbi.useExtension(DatabaseDao.class, dao -> {
            pgVersion = dao.pgVersion();
            if (!dao.tableExists(TASK_TABLE)) {
                throw new IllegalStateException("Table " + TASK_TABLE + " is missing, run the Flyway migrations first");
            }
        });
        log.infof("Task store on %s", pgVersion);
    }

    @Override
    protected void doStop() {
        log.debug("Task store connection pool is closed by Agroal");
    }

    /**
     * Round-trips a {@code SELECT 1}. A failure puts the service, and the engine with it,
     * into FAILED; the first successful ping afterwards resumes both.
     *
     * @return true if the database answered and the service is RUNNING
     */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
        } catch (RuntimeException e) {
            fail(e);
            return false;
        }
        return state() != State.FAILED || resume();
    }

    public String pgVersion() {
        return pgVersion;
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new IllegalStateException("Task store database unavailable", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping DatabaseService", e);
        }
    }
}
