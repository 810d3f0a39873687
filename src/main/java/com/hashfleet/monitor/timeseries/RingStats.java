package com.hashfleet.monitor.timeseries;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics over one dimension of a {@link TimeSeriesRing}.
 * <p>
 * {@code ratePerSecond} is {@code sum / spanSeconds}, zero when the span is zero.
 */
public record RingStats(
        @JsonProperty("count") int count,
        @JsonProperty("sum") double sum,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max,
        @JsonProperty("average") double average,
        @JsonProperty("span_seconds") double spanSeconds,
        @JsonProperty("rate_per_second") double ratePerSecond
) {
    public static final RingStats EMPTY = new RingStats(0, 0, 0, 0, 0, 0, 0);
}
