package com.aletheia.engine.core.task;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One worker's answer for a task. {@code result} is opaque to the engine and only ever
 * compared through its canonical form.
 */
public record VerificationResult(
        String workerId,
        Object result,
        double confidence,
        double timeSpentSeconds,
        Instant submittedAt,
        Map<String, Object> metadata
) {
    public VerificationResult {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
