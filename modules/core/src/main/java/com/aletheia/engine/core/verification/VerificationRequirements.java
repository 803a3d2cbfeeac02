package com.aletheia.engine.core.verification;

import com.aletheia.engine.core.task.Task;

/**
 * What a task needs before its result can be consolidated.
 */
public record VerificationRequirements(int verificationThreshold) {

    public VerificationRequirements {
        if (verificationThreshold < 1) {
            throw new IllegalArgumentException("verificationThreshold must be >= 1, got: " + verificationThreshold);
        }
    }

    public static VerificationRequirements of(Task task) {
        return new VerificationRequirements(task.verificationThreshold());
    }
}
