package com.hashfleet.monitor.broadcast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hashfleet.monitor.model.AggregateStats;
import com.hashfleet.monitor.model.ProducerReport;

/**
 * Pushed to observers after every accepted report.
 */
public record ReportUpdate(
        @JsonProperty("instance") ProducerReport instance,
        @JsonProperty("stats") AggregateStats stats
) {}
