package com.hashfleet.monitor.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted-history summary.
 *
 * @param window how the figures were obtained; {@link SummaryWindow#CURRENT_SNAPSHOT}
 *               means {@code hours} was not applied
 */
public record HistorySummary(
        @JsonProperty("unique_instances") long uniqueInstances,
        @JsonProperty("total_hashes") long totalUnits,
        @JsonProperty("avg_hashrate") double avgRate,
        @JsonProperty("peak_hashrate") double peakRate,
        @JsonProperty("hours") int hours,
        @JsonProperty("window") SummaryWindow window
) {

    public static HistorySummary empty(int hours, SummaryWindow window) {
        return new HistorySummary(0, 0, 0, 0, hours, window);
    }
}
