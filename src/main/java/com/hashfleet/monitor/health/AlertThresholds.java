package com.hashfleet.monitor.health;

/**
 * Alert thresholds; a metric strictly above its threshold raises an alert.
 *
 * @param writeLatencyMs    warning
 * @param errorRate         critical, as a fraction (0.01 = 1%)
 * @param queueDepth        warning
 * @param bufferLagSeconds  warning
 * @param workerUtilization info, as a fraction
 */
public record AlertThresholds(
        double writeLatencyMs,
        double errorRate,
        long queueDepth,
        double bufferLagSeconds,
        double workerUtilization
) {

    public static AlertThresholds defaults() {
        return new AlertThresholds(100, 0.01, 50_000, 10, 0.9);
    }
}
