package com.hashfleet.monitor.ingest;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Required-field check for inbound reports.
 * <p>
 * Fields are checked in wire order and the first one that is absent (or
 * null) is reported. Nothing of a rejected report is ingested.
 */
public final class ReportValidator {

    private static final Map<String, Function<ReportRequest, Object>> REQUIRED = new LinkedHashMap<>();

    static {
        REQUIRED.put("instance_id", ReportRequest::getInstanceId);
        REQUIRED.put("total_hashes", ReportRequest::getTotalHashes);
        REQUIRED.put("overall_hashrate", ReportRequest::getOverallHashrate);
        REQUIRED.put("recent_hashrate", ReportRequest::getRecentHashrate);
        REQUIRED.put("timestamp", ReportRequest::getTimestamp);
        REQUIRED.put("gpu_count", ReportRequest::getGpuCount);
        REQUIRED.put("gpu_available", ReportRequest::getGpuAvailable);
    }

    private ReportValidator() {}

    /**
     * @throws ReportValidationException naming the first missing or invalid field
     */
    public static void validate(ReportRequest request) {
        if (request == null) {
            throw new ReportValidationException("request", "Missing report body");
        }
        for (Map.Entry<String, Function<ReportRequest, Object>> field : REQUIRED.entrySet()) {
            if (field.getValue().apply(request) == null) {
                throw new ReportValidationException(field.getKey(), "Missing field: " + field.getKey());
            }
        }
        if (request.getInstanceId().isBlank()) {
            throw new ReportValidationException("instance_id", "Invalid field: instance_id must not be blank");
        }
        if (request.getGpuCount() < 0) {
            throw new ReportValidationException("gpu_count", "Invalid field: gpu_count must not be negative");
        }
    }
}
