package com.hashfleet.monitor.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One persisted report as returned by history queries.
 * Device readings are null when the producer did not send them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryRecord(
        @JsonProperty("instance_id") String producerId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("hashrate") double recentRate,
        @JsonProperty("overall_hashrate") double lifetimeRate,
        @JsonProperty("total_hashes") long totalUnits,
        @JsonProperty("gpu_count") int deviceCount,
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("power") Double power
) {}
