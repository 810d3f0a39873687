package com.hashfleet.monitor.health;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Metric push from the ingestion pipeline. Every category is optional;
 * missing numbers default to zero, a missing batch outcome to success.
 * Keys this service does not know are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineUpdate {

    @JsonProperty("bigtable")
    private StoreMetrics store;

    @JsonProperty("buffer")
    private BufferMetrics buffer;

    @JsonProperty("workers")
    private WorkerMetrics workers;

    @JsonProperty("batch")
    private BatchOutcome batch;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreMetrics {
        @JsonProperty("writes_per_second")
        private double writesPerSecond;

        @JsonProperty("latency_ms")
        private double latencyMs;

        @JsonProperty("error_rate")
        private double errorRate;

        @JsonProperty("shard_stats")
        private Map<String, Long> shardStats;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BufferMetrics {
        @JsonProperty("queue_depth")
        private long queueDepth;

        @JsonProperty("lag_seconds")
        private double lagSeconds;

        @JsonProperty("messages_buffered")
        private long messagesBuffered;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WorkerMetrics {
        @JsonProperty("pool_size")
        private int poolSize;

        @JsonProperty("utilization")
        private double utilization;

        @JsonProperty("batch_efficiency")
        private double batchEfficiency;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BatchOutcome {
        @JsonProperty("size")
        private int size;

        // null means success
        @JsonProperty("success")
        private Boolean success;

        @JsonProperty("retries")
        private int retries;
    }
}
