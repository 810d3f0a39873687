package com.hashfleet.monitor.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable periodic capture of the gauges and counters.
 */
public record PipelineMetricsSnapshot(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("metrics") PipelineGauges gauges,
        @JsonProperty("counters") PipelineCounters counters
) {}
