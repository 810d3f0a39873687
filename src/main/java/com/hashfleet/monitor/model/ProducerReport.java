package com.hashfleet.monitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One producer's self-reported state at a point in time.
 * <p>
 * {@code originAddress} and {@code receivedAt} are server-assigned.
 * {@code receivedAt} drives staleness; {@code reportTimestamp} is the
 * producer's own clock and is only used to order history.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProducerReport {

    @JsonProperty("instance_id")
    private String producerId;

    @JsonProperty("total_hashes")
    private long totalUnits;

    @JsonProperty("overall_hashrate")
    private double lifetimeRate;

    @JsonProperty("recent_hashrate")
    private double recentRate;

    @JsonProperty("timestamp")
    private String reportTimestamp;

    @JsonProperty("gpu_count")
    private int deviceCount;

    @JsonProperty("gpu_available")
    private boolean deviceAvailable;

    @JsonProperty("ip_address")
    private String originAddress;

    @JsonProperty("last_seen")
    private Instant receivedAt;

    // Optional extended device fields, forwarded when the producer sends them
    @JsonUnwrapped
    private DeviceTelemetry device;
}
