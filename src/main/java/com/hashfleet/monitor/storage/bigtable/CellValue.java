package com.hashfleet.monitor.storage.bigtable;

/**
 * One cell version. Timestamps are microseconds since the epoch at
 * millisecond granularity.
 */
public record CellValue(String family, String qualifier, long timestampMicros, String value) {}
