package com.hashfleet.monitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fleet-wide aggregates over the currently active producers.
 * Derived on every query, never stored.
 */
public record AggregateStats(
        @JsonProperty("total_instances") int instanceCount,
        @JsonProperty("total_hashrate") double totalRate,
        @JsonProperty("total_hashes") long totalUnits,
        @JsonProperty("total_gpus") long totalDevices,
        @JsonProperty("avg_hashrate") double avgRate
) {
    public static final AggregateStats EMPTY = new AggregateStats(0, 0, 0, 0, 0);
}
