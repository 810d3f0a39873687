package com.hashfleet.monitor.storage;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

public class RecordTimestampsTest {

    private static final Instant FALLBACK = Instant.parse("2026-01-24T12:00:00Z");

    @Test
    void testNaiveTimestampIsUtc() {
        assertThat(RecordTimestamps.resolve("2026-01-24T10:15:30.123456", FALLBACK))
                .isEqualTo(Instant.parse("2026-01-24T10:15:30.123456Z"));
    }

    @Test
    void testOffsetIsApplied() {
        assertThat(RecordTimestamps.resolve("2026-01-24T12:15:30+02:00", FALLBACK))
                .isEqualTo(Instant.parse("2026-01-24T10:15:30Z"));
    }

    @Test
    void testMissingOrInvalidFallsBack() {
        assertThat(RecordTimestamps.resolve(null, FALLBACK)).isEqualTo(FALLBACK);
        assertThat(RecordTimestamps.resolve("  ", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(RecordTimestamps.resolve("24/01/2026", FALLBACK)).isEqualTo(FALLBACK);
    }

    /**
     * Fixed width keeps string order equal to time order.
     */
    @Test
    void testFormatIsFixedWidth() {
        String whole = RecordTimestamps.format(Instant.parse("2026-01-24T12:00:09Z"));
        String fraction = RecordTimestamps.format(Instant.parse("2026-01-24T12:00:10.5Z"));

        assertThat(whole).isEqualTo("2026-01-24T12:00:09.000000Z");
        assertThat(fraction).isEqualTo("2026-01-24T12:00:10.500000Z");
        assertThat(whole.length()).isEqualTo(fraction.length());
        assertThat(whole).isLessThan(fraction);
        assertThat(RecordTimestamps.parse(fraction)).isEqualTo(Instant.parse("2026-01-24T12:00:10.5Z"));
    }
}
