package com.hashfleet.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional per-device readings a producer may attach to a report.
 * Every field is nullable; absent fields are neither stored nor serialized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceTelemetry {

    @JsonProperty("hashrate")
    private Double hashrate;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("gpu_name")
    private String name;

    @JsonProperty("power")
    private Double power;

    @JsonProperty("efficiency")
    private Double efficiency;

    @JsonIgnore
    public boolean isEmpty() {
        return hashrate == null && temperature == null && name == null
                && power == null && efficiency == null;
    }
}
