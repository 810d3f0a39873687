package com.hashfleet.monitor.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Latest value of every pushed pipeline gauge.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PipelineGauges {

    /* -------- Remote store -------- */

    @JsonProperty("bigtable_writes_per_second")
    private double storeWritesPerSecond;

    @JsonProperty("bigtable_write_latency_ms")
    private double storeWriteLatencyMs;

    @JsonProperty("bigtable_error_rate")
    private double storeErrorRate;

    @JsonProperty("shard_distribution")
    private Map<String, Long> shardDistribution;

    /* -------- Buffer -------- */

    @JsonProperty("buffer_queue_depth")
    private long bufferQueueDepth;

    @JsonProperty("buffer_lag_seconds")
    private double bufferLagSeconds;

    /* -------- Workers -------- */

    @JsonProperty("worker_pool_size")
    private int workerPoolSize;

    @JsonProperty("worker_utilization")
    private double workerUtilization;

    @JsonProperty("batch_efficiency")
    private double batchEfficiency;

    @JsonProperty("retry_rate")
    private double retryRate;
}
