package com.aletheia.engine.core.fraud;

/**
 * Weighted contribution of each signal to the 0-100 risk score. The four values sum to the score.
 */
public record SignalBreakdown(double reputation, double activity, double network, double quality) {
}
