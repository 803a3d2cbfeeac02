package com.aletheia.engine.core.fraud;

import com.aletheia.engine.types.FraudLevel;

import java.util.List;

/**
 * @param riskScore  0-100
 * @param confidence share of the four signals that had enough data to judge, 0-1
 */
public record FraudDetectionResult(
        boolean fraudulent,
        double riskScore,
        FraudLevel fraudLevel,
        double confidence,
        List<String> reasons,
        SignalBreakdown breakdown
) {
    public FraudDetectionResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
