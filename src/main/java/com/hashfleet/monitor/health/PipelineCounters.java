package com.hashfleet.monitor.health;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Running totals since process start.
 */
public record PipelineCounters(
        @JsonProperty("total_writes") long totalWrites,
        @JsonProperty("failed_writes") long failedWrites,
        @JsonProperty("total_retries") long totalRetries,
        @JsonProperty("total_batches") long totalBatches,
        @JsonProperty("messages_buffered") long messagesBuffered,
        @JsonProperty("messages_processed") long messagesProcessed
) {}
