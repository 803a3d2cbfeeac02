package com.aletheia.engine.api;

import com.aletheia.engine.core.verification.VerificationSubmission;

import java.util.Map;

public record SubmissionRequest(
        String workerId,
        Object result,
        Double confidence,
        Double timeSpentSeconds,
        Map<String, Object> metadata
) {
    VerificationSubmission toSubmission() {
        return new VerificationSubmission(result, confidence, timeSpentSeconds, metadata);
    }
}
