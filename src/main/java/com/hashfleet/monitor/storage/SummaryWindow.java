package com.hashfleet.monitor.storage;

/**
 * What a {@link HistorySummary} actually covers.
 */
public enum SummaryWindow {

    /**
     * Aggregated over every record inside the requested trailing window.
     */
    TRAILING_WINDOW,

    /**
     * Derived from the latest per-producer state only, whatever window was
     * requested. The wide-column backend has no native aggregation.
     */
    CURRENT_SNAPSHOT,

    /**
     * No history could be read; every figure is zero.
     */
    UNAVAILABLE
}
