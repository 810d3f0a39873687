package com.hashfleet.monitor.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Latest known state of a producer as reconstructed from persisted cells.
 * <p>
 * Fields are merged independently (last write wins per field), so an entry
 * can mix values from different reports when their cells were written in a
 * different order than the reports themselves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StoredInstance {

    @JsonProperty("instance_id")
    private String producerId;

    @JsonProperty("last_seen")
    private String lastSeen;

    @JsonProperty("hashrate")
    private double recentRate;

    @JsonProperty("overall_hashrate")
    private double lifetimeRate;

    @JsonProperty("total_hashes")
    private long totalUnits;

    @JsonProperty("gpu_count")
    private int deviceCount;

    @JsonProperty("gpu_available")
    private boolean deviceAvailable;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("gpu_name")
    private String deviceName;

    @JsonProperty("power")
    private Double power;

    @JsonProperty("efficiency")
    private Double efficiency;
}
