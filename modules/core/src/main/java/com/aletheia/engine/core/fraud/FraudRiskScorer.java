package com.aletheia.engine.core.fraud;

import com.aletheia.engine.types.FraudLevel;
import com.aletheia.engine.types.TaskType;
import com.aletheia.engine.util.Averages;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores a worker's activity on four signals (reputation, activity pattern, network,
 * decision quality), each in [0, 1] and equal to the strongest rule that fired, and
 * combines them into a weighted 0-100 risk score.
 *
 * <p>Pure: nothing is read or written besides the arguments. Raising any one signal
 * never lowers the resulting {@link FraudLevel}.
 */
@ApplicationScoped
public class FraudRiskScorer {

    private static final Logger log = Logger.getLogger(FraudRiskScorer.class);

    static final int MIN_RECENT_FOR_SPEED = 5;
    static final int MIN_RECENT_FOR_PATTERNS = 10;
    static final int MIN_LIFETIME_DECISIONS = 10;

    @ConfigProperty(name = "aletheia.fraud.threshold.low", defaultValue = "0.2")
    double lowThreshold;

    @ConfigProperty(name = "aletheia.fraud.threshold.medium", defaultValue = "0.4")
    double mediumThreshold;

    @ConfigProperty(name = "aletheia.fraud.threshold.high", defaultValue = "0.6")
    double highThreshold;

    @ConfigProperty(name = "aletheia.fraud.threshold.critical", defaultValue = "0.8")
    double criticalThreshold;

    @ConfigProperty(name = "aletheia.fraud.weight.reputation", defaultValue = "0.3")
    double reputationWeight;

    @ConfigProperty(name = "aletheia.fraud.weight.activity", defaultValue = "0.2")
    double activityWeight;

    @ConfigProperty(name = "aletheia.fraud.weight.network", defaultValue = "0.2")
    double networkWeight;

    @ConfigProperty(name = "aletheia.fraud.weight.quality", defaultValue = "0.3")
    double qualityWeight;

    @ConfigProperty(name = "aletheia.fraud.max-tasks-per-hour", defaultValue = "50")
    int maxTasksPerHour;

    @ConfigProperty(name = "aletheia.fraud.min-processing-time-seconds", defaultValue = "5")
    double minProcessingTimeSeconds;

    @ConfigProperty(name = "aletheia.fraud.max-tasks-per-ip", defaultValue = "100")
    int maxTasksPerIp;

    @ConfigProperty(name = "aletheia.fraud.max-workers-per-device", defaultValue = "1")
    int maxWorkersPerDevice;

    @ConfigProperty(name = "aletheia.fraud.baseline-approval-rate", defaultValue = "0.7")
    double baselineApprovalRate;

    private FraudPolicy policy;

    @PostConstruct
    void init() {
        policy = new FraudPolicy(lowThreshold, mediumThreshold, highThreshold, criticalThreshold,
                reputationWeight, activityWeight, networkWeight, qualityWeight,
                maxTasksPerHour, minProcessingTimeSeconds, maxTasksPerIp, maxWorkersPerDevice,
                baselineApprovalRate);
        log.debugf("Fraud policy: %s", policy);
    }

    /** Scorer with a fixed policy, outside the container. */
    public static FraudRiskScorer of(FraudPolicy policy) {
        FraudRiskScorer scorer = new FraudRiskScorer();
        scorer.policy = policy;
        return scorer;
    }

    public FraudPolicy policy() {
        return policy;
    }

    /**
     * @param metrics may be null for a worker without a profile yet
     */
    public FraudDetectionResult assessRisk(WorkerActivity activity, WorkerMetrics metrics) {
        if (activity == null) {
            throw new IllegalArgumentException("activity cannot be null");
        }
        List<String> reasons = new ArrayList<>();
        Signal reputation = reputation(metrics, reasons);
        Signal pattern = activityPattern(activity, reasons);
        Signal network = network(activity, reasons);
        Signal quality = quality(activity, metrics, reasons);

        double total = policy.totalWeight();
        SignalBreakdown breakdown = new SignalBreakdown(
                100 * policy.reputationWeight() * reputation.score / total,
                100 * policy.activityWeight() * pattern.score / total,
                100 * policy.networkWeight() * network.score / total,
                100 * policy.qualityWeight() * quality.score / total);
        double score = Averages.clamp(
                breakdown.reputation() + breakdown.activity() + breakdown.network() + breakdown.quality(),
                0, 100);

        FraudLevel level = levelFor(score);
        int judged = (reputation.hadData ? 1 : 0) + (pattern.hadData ? 1 : 0)
                + (network.hadData ? 1 : 0) + (quality.hadData ? 1 : 0);

        FraudDetectionResult result = new FraudDetectionResult(level.isFraudulent(), score, level,
                judged / 4.0, reasons, breakdown);
        if (level.isFraudulent()) {
            log.infof("Worker %s assessed %s (score=%.1f): %s", activity.workerId(), level, score, reasons);
        }
        return result;
    }

    FraudLevel levelFor(double score) {
        double normalized = score / 100;
        if (normalized >= policy.criticalThreshold()) return FraudLevel.CRITICAL;
        if (normalized >= policy.highThreshold()) return FraudLevel.HIGH;
        if (normalized >= policy.mediumThreshold()) return FraudLevel.MEDIUM;
        return FraudLevel.LOW;
    }

    private Signal reputation(WorkerMetrics metrics, List<String> reasons) {
        if (metrics == null) {
            return Signal.NO_DATA;
        }
        double score = 0;
        if (!metrics.accuracyHistory().isEmpty()) {
            double accuracy = Averages.mean(metrics.accuracyHistory(), 1.0);
            if (accuracy < 0.6) {
                score = Math.max(score, 1 - accuracy);
                reasons.add(String.format("Low accuracy: %.0f%%", accuracy * 100));
            }
        }
        if (metrics.accountAgeDays() < 7) {
            score = Math.max(score, 0.5);
            reasons.add("Account is " + metrics.accountAgeDays() + " day(s) old");
        } else if (metrics.accountAgeDays() < 30) {
            score = Math.max(score, 0.2);
            reasons.add("Account is less than 30 days old");
        }
        if (metrics.priorViolations() > 0) {
            score = Math.max(score, Math.min(1.0, 0.25 * metrics.priorViolations()));
            reasons.add(metrics.priorViolations() + " prior violation(s)");
        }
        return new Signal(score, true);
    }

    private Signal activityPattern(WorkerActivity activity, List<String> reasons) {
        List<ActivityEntry> recent = activity.recentActivity();
        double score = 0;
        double current = activity.processingTimeSeconds();

        if (current > 0 && current < policy.minProcessingTimeSeconds()) {
            score = Math.max(score, 0.9);
            reasons.add(String.format("Processing time %.1fs is below the %.1fs minimum",
                    current, policy.minProcessingTimeSeconds()));
        }

        if (recent.size() >= MIN_RECENT_FOR_SPEED && current > 0) {
            double average = Averages.mean(recent, ActivityEntry::processingTimeSeconds, 0);
            if (average > 0) {
                double ratio = current / average;
                if (ratio < 0.5) {
                    score = Math.max(score, 0.7);
                    reasons.add(String.format("Processing time is %.0f%% of recent average", ratio * 100));
                } else if (ratio < 0.7) {
                    score = Math.max(score, 0.4);
                    reasons.add(String.format("Processing time is %.0f%% of recent average", ratio * 100));
                }
            }
        }

        if (recent.size() >= MIN_RECENT_FOR_PATTERNS) {
            double perHour = tasksPerHour(recent);
            if (perHour > policy.maxTasksPerHour()) {
                score = Math.max(score, 0.8);
                reasons.add(String.format("%.0f tasks/hour exceeds the limit of %d", perHour, policy.maxTasksPerHour()));
            }

            Map<TaskType, Integer> byType = new EnumMap<>(TaskType.class);
            for (ActivityEntry entry : recent) {
                if (entry.taskType() != null) {
                    byType.merge(entry.taskType(), 1, Integer::sum);
                }
            }
            for (Map.Entry<TaskType, Integer> e : byType.entrySet()) {
                double share = (double) e.getValue() / recent.size();
                if (share > 0.9) {
                    score = Math.max(score, 0.6);
                    reasons.add(String.format("%.0f%% of recent tasks are %s", share * 100, e.getKey()));
                }
            }

            List<Long> intervals = intervalsSeconds(recent);
            if (intervals.size() > 5) {
                Set<Long> distinct = new HashSet<>(intervals);
                if (distinct.size() < 0.3 * intervals.size()) {
                    score = Math.max(score, 0.9);
                    reasons.add("Submission intervals are near-identical");
                }
            }
        }

        return new Signal(score, current > 0 || !recent.isEmpty());
    }

    private Signal network(WorkerActivity activity, List<String> reasons) {
        boolean hadData = activity.ipAddress() != null || activity.deviceFingerprint() != null;
        double score = 0;
        if (activity.ipTaskCount() > policy.maxTasksPerIp()) {
            score = Math.max(score, 0.8);
            reasons.add(activity.ipTaskCount() + " tasks from one IP address");
        }
        if (activity.deviceWorkerCount() > policy.maxWorkersPerDevice()) {
            score = Math.max(score, 0.9);
            reasons.add("Device shared by " + activity.deviceWorkerCount() + " workers");
        }
        return new Signal(score, hadData);
    }

    private Signal quality(WorkerActivity activity, WorkerMetrics metrics, List<String> reasons) {
        List<ActivityEntry> recent = activity.recentActivity();
        boolean hadData = false;
        double score = 0;

        if (recent.size() >= MIN_RECENT_FOR_PATTERNS) {
            hadData = true;
            long approved = recent.stream().filter(e -> e.decision() == ActivityEntry.Decision.APPROVED).count();
            double approvedShare = (double) approved / recent.size();
            double dominant = Math.max(approvedShare, 1 - approvedShare);
            if (dominant > 0.95) {
                score = Math.max(score, 0.7);
                reasons.add(String.format("%.0f%% of recent decisions are identical", dominant * 100));
            }
        }

        if (metrics != null && metrics.totalDecisions() >= MIN_LIFETIME_DECISIONS) {
            hadData = true;
            double rate = (double) metrics.approvedCount() / metrics.totalDecisions();
            if (rate >= 0.9 || rate <= 0.1) {
                score = Math.max(score, 0.5);
                reasons.add(String.format("Skewed approval rate: %.0f%%", rate * 100));
            }
            if (Math.abs(rate - policy.baselineApprovalRate()) > 0.3) {
                score = Math.max(score, 0.6);
                reasons.add(String.format("Approval rate %.0f%% deviates from baseline %.0f%%",
                        rate * 100, policy.baselineApprovalRate() * 100));
            }
        }
        return new Signal(score, hadData);
    }

    /** Entries per hour over the span they cover, with the span floored at one hour. */
    static double tasksPerHour(List<ActivityEntry> recent) {
        Instant first = recent.get(0).timestamp();
        Instant last = first;
        for (ActivityEntry e : recent) {
            if (e.timestamp().isBefore(first)) first = e.timestamp();
            if (e.timestamp().isAfter(last)) last = e.timestamp();
        }
        double hours = Math.max(1.0, Duration.between(first, last).toMillis() / 3_600_000.0);
        return recent.size() / hours;
    }

    static List<Long> intervalsSeconds(List<ActivityEntry> recent) {
        List<Instant> times = new ArrayList<>(recent.size());
        for (ActivityEntry e : recent) {
            times.add(e.timestamp());
        }
        times.sort(null);
        List<Long> intervals = new ArrayList<>(times.size());
        for (int i = 1; i < times.size(); i++) {
            intervals.add(Duration.between(times.get(i - 1), times.get(i)).toSeconds());
        }
        return intervals;
    }

    private record Signal(double score, boolean hadData) {
        static final Signal NO_DATA = new Signal(0, false);
    }
}
