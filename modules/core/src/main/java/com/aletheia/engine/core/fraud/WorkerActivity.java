package com.aletheia.engine.core.fraud;

import com.aletheia.engine.types.TaskType;

import java.util.List;

/**
 * Snapshot of what a worker is doing right now plus their recent history.
 *
 * @param processingTimeSeconds time spent on the submission under assessment
 * @param ipTaskCount           tasks seen from {@code ipAddress} in the current window
 * @param deviceWorkerCount     distinct workers seen on {@code deviceFingerprint}
 */
public record WorkerActivity(
        String workerId,
        TaskType taskType,
        double processingTimeSeconds,
        String ipAddress,
        String deviceFingerprint,
        int ipTaskCount,
        int deviceWorkerCount,
        List<ActivityEntry> recentActivity
) {
    public WorkerActivity {
        recentActivity = recentActivity == null ? List.of() : List.copyOf(recentActivity);
    }
}
