package com.hashfleet.monitor.storage;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Timestamp normalization shared by both history backends.
 * <p>
 * Persisted timestamps are fixed-width UTC strings with microsecond precision
 * ({@code 2026-01-24T12:00:00.000000Z}) so that lexicographic order is
 * chronological order. Producers send ISO-8601 with or without an offset;
 * values without an offset are taken as UTC.
 */
@Slf4j
public final class RecordTimestamps {

    public static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private RecordTimestamps() {}

    /**
     * Resolve a producer-supplied timestamp, falling back to {@code fallback}
     * when it is missing or not ISO-8601.
     */
    public static Instant resolve(String reportTimestamp, Instant fallback) {
        if (reportTimestamp == null || reportTimestamp.isBlank()) {
            return fallback;
        }
        try {
            return parseIso(reportTimestamp.trim());
        } catch (DateTimeParseException e) {
            log.debug("Unparseable report timestamp '{}', using receive time", reportTimestamp);
            return fallback;
        }
    }

    public static String format(Instant instant) {
        return FORMAT.format(instant);
    }

    /**
     * @throws DateTimeParseException if {@code normalized} was not produced by {@link #format}
     */
    public static Instant parse(String normalized) {
        return Instant.parse(normalized);
    }

    private static Instant parseIso(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }
}
