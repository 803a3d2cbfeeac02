package com.aletheia.engine.core.service;

import jakarta.enterprise.event.Event;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle shared by the engine's services. {@link #start()} refuses to run while a
 * {@link DependsOn} dependency is down, and a FAILED service can be brought back with
 * {@link #resume()}; {@link ServiceDependencyCascade} drives both directions.
 *
 * <p>Outside a container the CDI fields stay null: transitions are then only logged and
 * dependencies are not checked.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private volatile String lastFailure;

    @Inject
    Event<ServiceStateChangedEvent> stateEvent;

    @Inject
    Instance<ManagedService> allServices;

    protected final Logger log = Logger.getLogger(getClass());

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public Optional<String> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    @Override
    public void start() throws Exception {
        State current = state.get();
        if (current == State.RUNNING || current == State.STARTING) {
            return;
        }
        ManagedService blocker = dependencyNotRunning();
        if (blocker != null) {
            throw new IllegalStateException("Cannot start '" + serviceId() + "': dependency '"
                    + blocker.serviceId() + "' is " + blocker.state());
        }
        announce(State.STARTING, null);
        try {
            doStart();
        } catch (Exception e) {
            fail(e);
            throw e;
        }
        lastFailure = null;
        announce(State.RUNNING, null);
    }

    @Override
    public void stop() throws Exception {
        State current = state.get();
        if (current == State.STOPPED || current == State.STOPPING) {
            return;
        }
        announce(State.STOPPING, null);
        try {
            doStop();
        } catch (Exception e) {
            fail(e);
            throw e;
        }
        announce(State.STOPPED, null);
    }

    @Override
    public void fail(Throwable cause) {
        if (state.get() == State.FAILED) {
            return;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        lastFailure = message;
        log.errorf("Service '%s' failed: %s", serviceId(), message);
        announce(State.FAILED, message);
    }

    @Override
    public boolean resume() {
        if (state.get() != State.FAILED) {
            return isRunning();
        }
        log.infof("Service '%s': resuming after failure (%s)", serviceId(), lastFailure);
        try {
            start();
        } catch (Exception e) {
            // start() already recorded the failure and moved back to FAILED
            log.warnf("Service '%s' could not resume: %s", serviceId(), e.getMessage());
        }
        return isRunning();
    }

    private void announce(State newState, String detail) {
        State old = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), old, newState);
        if (stateEvent != null) {
            stateEvent.fire(new ServiceStateChangedEvent(serviceId(), old, newState, detail, Instant.now()));
        }
    }

    private ManagedService dependencyNotRunning() {
        if (allServices == null) {
            return null;
        }
        for (Class<? extends ManagedService> dependency : dependencies()) {
            for (ManagedService svc : allServices) {
                if (dependency.isInstance(svc) && !svc.isRunning()) {
                    return svc;
                }
            }
        }
        return null;
    }
}
