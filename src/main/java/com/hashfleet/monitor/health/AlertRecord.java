package com.hashfleet.monitor.health;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A threshold breach observed on a metric push.
 */
public record AlertRecord(
        @JsonProperty("timestamp")
        @JsonFormat(shape = JsonFormat.Shape.STRING, timezone = "UTC")
        Instant timestamp,

        @JsonProperty("level")
        AlertSeverity severity,

        @JsonProperty("message")
        String message
) {}
