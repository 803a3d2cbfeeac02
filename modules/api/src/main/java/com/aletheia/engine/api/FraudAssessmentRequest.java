package com.aletheia.engine.api;

import com.aletheia.engine.core.fraud.WorkerActivity;
import com.aletheia.engine.core.fraud.WorkerMetrics;

public record FraudAssessmentRequest(WorkerActivity activity, WorkerMetrics metrics) {
}
