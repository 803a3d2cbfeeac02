package com.aletheia.engine.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Propagates service health along {@link DependsOn}: a service that fails takes its
 * dependents down, and when it is RUNNING again the dependents failed on its account are
 * resumed. Dependents that failed for their own reasons stay FAILED.
 *
 * <p>A separate bean so that events fired from {@code @PostConstruct} do not re-enter bean
 * creation; for the same reason RUNNING events only touch other beans when this cascade
 * failed something earlier.
 */
@ApplicationScoped
public class ServiceDependencyCascade {

    private static final Logger log = Logger.getLogger(ServiceDependencyCascade.class);

    @Inject
    Instance<ManagedService> allServices;

    /** Failed service id to the ids of the dependents it took down. */
    private final Map<String, Set<String>> cascaded = new ConcurrentHashMap<>();

    void onServiceStateChanged(@Observes ServiceStateChangedEvent event) {
        if (event.isFailure()) {
            cascadeFailure(event.serviceId());
        } else if (event.newState() == ManagedService.State.RUNNING) {
            Set<String> dependents = cascaded.remove(event.serviceId());
            if (dependents != null) {
                resumeDependents(event.serviceId(), dependents);
            }
        }
    }

    private void cascadeFailure(String failedId) {
        ManagedService failed = find(failedId);
        if (failed == null) {
            return;
        }
        for (ManagedService svc : allServices) {
            if (svc.state() == ManagedService.State.FAILED || !dependsOn(svc, failed)) {
                continue;
            }
            log.warnf("Dependency '%s' failed, failing '%s'", failedId, svc.serviceId());
            cascaded.computeIfAbsent(failedId, id -> ConcurrentHashMap.newKeySet()).add(svc.serviceId());
            svc.fail(new IllegalStateException("Dependency '" + failedId + "' failed"));
        }
    }

    private void resumeDependents(String recoveredId, Set<String> dependentIds) {
        for (ManagedService svc : allServices) {
            if (dependentIds.contains(svc.serviceId()) && svc.state() == ManagedService.State.FAILED) {
                log.infof("Dependency '%s' is running again, resuming '%s'", recoveredId, svc.serviceId());
                svc.resume();
            }
        }
    }

    private static boolean dependsOn(ManagedService svc, ManagedService dependency) {
        for (Class<? extends ManagedService> type : svc.dependencies()) {
            if (type.isInstance(dependency)) {
                return true;
            }
        }
        return false;
    }

    private ManagedService find(String serviceId) {
        for (ManagedService svc : allServices) {
            if (svc.serviceId().equals(serviceId)) {
                return svc;
            }
        }
        return null;
    }
}
