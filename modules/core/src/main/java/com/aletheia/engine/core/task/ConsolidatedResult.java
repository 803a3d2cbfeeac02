package com.aletheia.engine.core.task;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single authoritative answer reduced from a task's submissions.
 *
 * @param result                  majority result value
 * @param confidence              mean confidence over all submissions
 * @param verifierCount           number of submissions consolidated
 * @param averageTimeSpentSeconds mean time spent over all submissions
 * @param agreementCount          size of the majority group
 * @param metadata                all submissions' metadata, later keys overwriting earlier ones
 */
public record ConsolidatedResult(
        Object result,
        double confidence,
        int verifierCount,
        double averageTimeSpentSeconds,
        int agreementCount,
        Map<String, Object> metadata,
        Instant consolidatedAt
) {
    public ConsolidatedResult {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Share of submissions that agreed with the majority result. */
    public double agreementRatio() {
        return verifierCount == 0 ? 0.0 : (double) agreementCount / verifierCount;
    }
}
