package com.aletheia.engine.core.fraud;

/**
 * Thresholds, weights and limits for {@link FraudRiskScorer}. Thresholds are on the
 * 0-1 scale and must be non-decreasing from low to critical.
 */
public record FraudPolicy(
        double lowThreshold,
        double mediumThreshold,
        double highThreshold,
        double criticalThreshold,
        double reputationWeight,
        double activityWeight,
        double networkWeight,
        double qualityWeight,
        int maxTasksPerHour,
        double minProcessingTimeSeconds,
        int maxTasksPerIp,
        int maxWorkersPerDevice,
        double baselineApprovalRate
) {
    public FraudPolicy {
        if (lowThreshold < 0 || criticalThreshold > 1
                || lowThreshold > mediumThreshold
                || mediumThreshold > highThreshold
                || highThreshold > criticalThreshold) {
            throw new IllegalArgumentException(String.format(
                    "Fraud thresholds must satisfy 0 <= low <= medium <= high <= critical <= 1, got %.2f/%.2f/%.2f/%.2f",
                    lowThreshold, mediumThreshold, highThreshold, criticalThreshold));
        }
        if (reputationWeight < 0 || activityWeight < 0 || networkWeight < 0 || qualityWeight < 0) {
            throw new IllegalArgumentException("Fraud signal weights must not be negative");
        }
        if (reputationWeight + activityWeight + networkWeight + qualityWeight <= 0) {
            throw new IllegalArgumentException("At least one fraud signal weight must be positive");
        }
    }

    public static FraudPolicy defaults() {
        return new FraudPolicy(0.2, 0.4, 0.6, 0.8,
                0.3, 0.2, 0.2, 0.3,
                50, 5.0, 100, 1, 0.7);
    }

    public double totalWeight() {
        return reputationWeight + activityWeight + networkWeight + qualityWeight;
    }
}
