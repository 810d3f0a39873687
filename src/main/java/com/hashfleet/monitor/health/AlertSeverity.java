package com.hashfleet.monitor.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String label;

    AlertSeverity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
