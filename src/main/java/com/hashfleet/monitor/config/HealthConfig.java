package com.hashfleet.monitor.config;

import com.hashfleet.monitor.health.AlertThresholds;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pipeline alert thresholds, each one configurable on its own.
 */
@Configuration
public class HealthConfig {

    @Bean
    public AlertThresholds alertThresholds(
            @Value("${monitor.thresholds.write-latency-ms:100}") double writeLatencyMs,
            @Value("${monitor.thresholds.error-rate:0.01}") double errorRate,
            @Value("${monitor.thresholds.queue-depth:50000}") long queueDepth,
            @Value("${monitor.thresholds.buffer-lag-seconds:10}") double bufferLagSeconds,
            @Value("${monitor.thresholds.worker-utilization:0.9}") double workerUtilization
    ) {
        return new AlertThresholds(writeLatencyMs, errorRate, queueDepth, bufferLagSeconds, workerUtilization);
    }
}
