package com.hashfleet.monitor.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hashfleet.monitor.storage.HistorySummary;

/**
 * Live aggregates next to the persisted 24h summary.
 */
public record FleetSummary(
        @JsonProperty("current") Current current,
        @JsonProperty("last_24h") HistorySummary last24h
) {

    public record Current(
            @JsonProperty("active_instances") int activeInstances,
            @JsonProperty("total_hashrate") double totalRate,
            @JsonProperty("total_gpus") long totalDevices,
            @JsonProperty("avg_hashrate") double avgRate
    ) {}
}
