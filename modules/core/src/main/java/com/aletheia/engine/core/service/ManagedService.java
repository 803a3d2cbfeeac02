package com.aletheia.engine.core.service;

import java.util.List;
import java.util.Optional;

/**
 * A component with an explicit lifecycle. Every transition is announced as a
 * {@link ServiceStateChangedEvent}.
 */
public interface ManagedService {

    enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    String serviceId();

    State state();

    void start() throws Exception;

    void stop() throws Exception;

    void fail(Throwable cause);

    /**
     * Restarts a FAILED service, typically after a dependency came back.
     *
     * @return true if the service is RUNNING afterwards
     */
    boolean resume();

    /** Message of the failure that put the service into FAILED, if any. */
    Optional<String> lastFailure();

    default boolean isRunning() {
        return state() == State.RUNNING;
    }

    /** Services named by {@link DependsOn} on this service's class, empty if none. */
    default List<Class<? extends ManagedService>> dependencies() {
        DependsOn dependsOn = getClass().getAnnotation(DependsOn.class);
        return dependsOn == null ? List.of() : List.of(dependsOn.value());
    }
}
