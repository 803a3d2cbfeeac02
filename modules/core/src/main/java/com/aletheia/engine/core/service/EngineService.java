package com.aletheia.engine.core.service;

import com.aletheia.engine.core.db.DatabaseService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Lifecycle switch for the periodic sweeps. The scheduler, verification monitor and
 * stalled-task recovery do nothing while this service is not RUNNING, so a failed
 * database takes them down with it.
 */
@ApplicationScoped
@Startup
@DependsOn(DatabaseService.class)
public class EngineService extends AbstractManagedService {

    @ConfigProperty(name = "aletheia.environment", defaultValue = "development")
    String environment;

    @ConfigProperty(name = "aletheia.task-store.type", defaultValue = "postgres")
    String taskStoreType;

    @Override
    public String serviceId() {
        return "engine";
    }

    @Override
    protected void doStart() {
        log.infof("Verification engine starting (environment=%s, task store=%s)", environment, taskStoreType);
    }

    @Override
    protected void doStop() {
        log.info("Verification engine stopped, sweeps paused");
    }

    public String environment() {
        return environment;
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("EngineService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping EngineService", e);
        }
    }
}
