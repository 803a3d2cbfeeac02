package com.aletheia.engine.core.health;

import com.aletheia.engine.core.service.EngineService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class EngineHealthCheck implements HealthCheck {

    @Inject
    EngineService engine;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("engine")
                .status(engine.isRunning())
                .withData("state", engine.state().name())
                .withData("environment", engine.environment());
        engine.lastFailure().ifPresent(failure -> builder.withData("lastFailure", failure));
        return builder.build();
    }
}
