package com.hashfleet.monitor.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the recurring tasks: registry eviction, pipeline snapshots and
 * retention sweeps. They stop with the application context; setting
 * {@code monitor.scheduling.enabled=false} keeps them from starting at all.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "monitor.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
