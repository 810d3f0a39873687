package com.hashfleet.monitor.health;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trailing figures over the snapshot ring.
 *
 * @param avgWritesPerSecond writes counted between the oldest and the newest snapshot, per second of ring span
 * @param successRate        {@code 1 - failed / max(1, processed)} since start
 */
public record PipelineTrend(
        @JsonProperty("avg_writes_per_second") double avgWritesPerSecond,
        @JsonProperty("total_messages_processed") long totalMessagesProcessed,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("time_span_seconds") double timeSpanSeconds,
        @JsonProperty("snapshots") int snapshots
) {}
