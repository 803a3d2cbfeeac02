package com.aletheia.engine.core.matching;

import com.aletheia.engine.core.task.Task;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class InMemoryWorkerDirectory implements WorkerDirectory {

    private static final Logger log = Logger.getLogger(InMemoryWorkerDirectory.class);

    private final ConcurrentHashMap<String, WorkerCandidate> workers = new ConcurrentHashMap<>();

    @Override
    public List<WorkerCandidate> candidatesFor(Task task) {
        return workers.values().stream()
                .filter(w -> w.accepts(task.type()))
                .toList();
    }

    @Override
    public void register(WorkerCandidate candidate) {
        WorkerCandidate previous = workers.put(candidate.workerId(), candidate);
        log.debugf("Worker %s %s (types=%s, matchScore=%.2f)", candidate.workerId(),
                previous == null ? "registered" : "updated", candidate.taskTypes(), candidate.matchScore());
    }

    @Override
    public boolean remove(String workerId) {
        return workers.remove(workerId) != null;
    }

    @Override
    public Optional<WorkerCandidate> find(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    @Override
    public List<WorkerCandidate> all() {
        return workers.values().stream()
                .sorted(Comparator.comparing(WorkerCandidate::workerId))
                .toList();
    }
}
