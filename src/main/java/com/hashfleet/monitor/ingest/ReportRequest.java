package com.hashfleet.monitor.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hashfleet.monitor.model.DeviceTelemetry;
import com.hashfleet.monitor.model.ProducerReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound report as sent by a producer.
 * <p>
 * Boxed types so that absent fields can be told apart from zero values;
 * see {@link ReportValidator} for which fields are required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReportRequest {

    @JsonProperty("instance_id")
    private String instanceId;

    @JsonProperty("total_hashes")
    private Long totalHashes;

    @JsonProperty("overall_hashrate")
    private Double overallHashrate;

    @JsonProperty("recent_hashrate")
    private Double recentHashrate;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("gpu_count")
    private Integer gpuCount;

    @JsonProperty("gpu_available")
    private Boolean gpuAvailable;

    /* -------- Optional device readings -------- */

    @JsonProperty("hashrate")
    private Double hashrate;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("gpu_name")
    private String gpuName;

    @JsonProperty("power")
    private Double power;

    @JsonProperty("efficiency")
    private Double efficiency;

    /**
     * Build the domain report. Only valid after {@link ReportValidator#validate}.
     */
    public ProducerReport toReport(String originAddress) {
        DeviceTelemetry device = DeviceTelemetry.builder()
                .hashrate(hashrate)
                .temperature(temperature)
                .name(gpuName)
                .power(power)
                .efficiency(efficiency)
                .build();

        return ProducerReport.builder()
                .producerId(instanceId)
                .totalUnits(totalHashes)
                .lifetimeRate(overallHashrate)
                .recentRate(recentHashrate)
                .reportTimestamp(timestamp)
                .deviceCount(gpuCount)
                .deviceAvailable(gpuAvailable)
                .originAddress(originAddress)
                .device(device.isEmpty() ? null : device)
                .build();
    }
}
