package com.aletheia.engine.core.matching;

import com.aletheia.engine.core.task.Task;

import java.util.List;
import java.util.Optional;

/**
 * Source of worker profiles. Stands in for the external worker-profile subsystem.
 */
public interface WorkerDirectory {

    /** Workers that take the task's type, in no particular order. */
    List<WorkerCandidate> candidatesFor(Task task);

    void register(WorkerCandidate candidate);

    /** @return true if the worker was known */
    boolean remove(String workerId);

    Optional<WorkerCandidate> find(String workerId);

    List<WorkerCandidate> all();
}
