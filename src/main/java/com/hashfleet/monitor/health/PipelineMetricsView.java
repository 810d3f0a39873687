package com.hashfleet.monitor.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read model served on the pipeline metrics endpoint.
 */
public record PipelineMetricsView(
        @JsonProperty("firehose") PipelineGauges gauges,
        @JsonProperty("counters") PipelineCounters counters,
        @JsonProperty("alerts") List<AlertRecord> recentAlerts,
        @JsonProperty("history") PipelineTrend trend
) {}
