package com.aletheia.engine.core.verification;

import java.util.Map;

/**
 * A worker's answer as received, before validation. Boxed fields are null when absent.
 */
public record VerificationSubmission(
        Object result,
        Double confidence,
        Double timeSpentSeconds,
        Map<String, Object> metadata
) {}
