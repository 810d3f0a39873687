package com.hashfleet.monitor.storage.bigtable;

import com.hashfleet.monitor.model.DeviceTelemetry;
import com.hashfleet.monitor.model.ProducerReport;
import com.hashfleet.monitor.storage.HistoryRecord;
import com.hashfleet.monitor.storage.HistorySummary;
import com.hashfleet.monitor.storage.PersistenceException;
import com.hashfleet.monitor.storage.StoredInstance;
import com.hashfleet.monitor.storage.SummaryWindow;
import com.hashfleet.monitor.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.hashfleet.monitor.testutil.TestFactory.BASE;
import static com.hashfleet.monitor.testutil.TestFactory.report;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BigtableHistoryStoreTest {

    private MutableClock clock;
    private InMemoryWideColumnTable table;
    private BigtableHistoryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(BASE);
        table = new InMemoryWideColumnTable();
        store = new BigtableHistoryStore(table, clock);
    }

    @Test
    void testRowKeyIsProducerAndNormalizedTimestamp() {
        store.write(report("p1", BASE, 10.0));

        assertThat(table.rowKeys()).containsExactly("p1#2026-01-24T12:00:00.000000Z");
    }

    /**
     * Scenario: p1 and p10 both have rows; history of p1 must not include p10.
     */
    @Test
    void testHistoryPrefixDoesNotLeakAcrossProducers() {
        store.write(report("p1", BASE.minusSeconds(60), 10.0));
        store.write(report("p10", BASE.minusSeconds(60), 99.0));
        store.write(report("p1", BASE.minusSeconds(30), 11.0));

        List<HistoryRecord> history = store.queryHistory("p1", 24);

        assertThat(history).extracting(HistoryRecord::producerId).containsOnly("p1");
        assertThat(history).extracting(HistoryRecord::recentRate).containsExactly(10.0, 11.0);
    }

    @Test
    void testHistoryExcludesRecordsOutsideWindow() {
        store.write(report("p1", BASE.minus(Duration.ofHours(3)), 1.0));
        store.write(report("p1", BASE.minus(Duration.ofMinutes(30)), 2.0));

        assertThat(store.queryHistory("p1", 1))
                .extracting(HistoryRecord::recentRate)
                .containsExactly(2.0);
        assertThat(store.queryHistory("p1", 24)).hasSize(2);
    }

    @Test
    void testHistoryKeepsNewestRowsAboveCap() {
        for (int i = 0; i < 1005; i++) {
            store.write(report("p1", BASE.minusSeconds(2000 - i), i));
        }

        List<HistoryRecord> history = store.queryHistory("p1", 24);

        assertThat(history).hasSize(1000);
        assertThat(history.get(0).recentRate()).isEqualTo(5.0);
        assertThat(history.get(999).recentRate()).isEqualTo(1004.0);
    }

    /**
     * Same producer and timestamp twice: one row key, so the later values replace the earlier ones.
     */
    @Test
    void testSameTimestampSharesRow() {
        store.write(report("p1", BASE, 10.0));
        clock.advance(Duration.ofMillis(5));
        store.write(report("p1", BASE, 12.0));

        assertThat(table.rowCount()).isEqualTo(1);
        assertThat(store.queryHistory("p1", 24))
                .singleElement()
                .extracting(HistoryRecord::recentRate)
                .isEqualTo(12.0);
    }

    /**
     * Scenario: p1 writes rate 10 then rate 20; the stored instance shows 20.
     */
    @Test
    void testInstancesReflectLatestWrite() {
        store.write(report("p1", BASE.minusSeconds(10), 10.0));
        clock.advanceSeconds(1);
        store.write(report("p1", BASE.minusSeconds(5), 20.0));
        store.write(report("p2", BASE.minusSeconds(5), 7.0));

        List<StoredInstance> instances = store.queryInstances();

        assertThat(instances).hasSize(2);
        StoredInstance p1 = instances.stream()
                .filter(i -> i.getProducerId().equals("p1"))
                .findFirst()
                .orElseThrow();
        assertThat(p1.getRecentRate()).isEqualTo(20.0);
        assertThat(p1.getLastSeen()).isEqualTo("2026-01-24T11:59:55.000000Z");
        assertThat(p1.getDeviceCount()).isEqualTo(1);
        assertThat(p1.isDeviceAvailable()).isTrue();
    }

    /**
     * Cells are merged by write time, not by report time: an older report
     * written last wins, and absent device fields keep older values.
     */
    @Test
    void testInstancesMergePerField() {
        ProducerReport withDevice = report("p1", BASE, 30.0).toBuilder()
                .device(DeviceTelemetry.builder().temperature(71.5).name("RTX 4090").build())
                .build();
        store.write(withDevice);
        clock.advanceSeconds(1);
        store.write(report("p1", BASE.minusSeconds(60), 5.0));

        StoredInstance p1 = store.queryInstances().get(0);

        assertThat(p1.getRecentRate()).isEqualTo(5.0);
        assertThat(p1.getLastSeen()).isEqualTo("2026-01-24T11:59:00.000000Z");
        assertThat(p1.getTemperature()).isEqualTo(71.5);
        assertThat(p1.getDeviceName()).isEqualTo("RTX 4090");
        assertThat(p1.getPower()).isNull();
    }

    @Test
    void testSummaryIsLabelledCurrentSnapshot() {
        store.write(report("p1", 100, 10.0));
        store.write(report("p2", 300, 30.0));

        HistorySummary summary = store.querySummary(24);

        assertThat(summary.window()).isEqualTo(SummaryWindow.CURRENT_SNAPSHOT);
        assertThat(summary.uniqueInstances()).isEqualTo(2);
        assertThat(summary.totalUnits()).isEqualTo(400);
        assertThat(summary.avgRate()).isEqualTo(20.0);
        assertThat(summary.peakRate()).isEqualTo(30.0);
        assertThat(summary.hours()).isEqualTo(24);
    }

    @Test
    void testEmptySummary() {
        assertThat(store.querySummary(6)).isEqualTo(HistorySummary.empty(6, SummaryWindow.CURRENT_SNAPSHOT));
    }

    /**
     * Rows age by the time they were written, not by the report timestamp.
     */
    @Test
    void testCleanupDeletesRowsWrittenBeforeRetention() {
        store.write(report("p1", BASE, 1.0));
        clock.advance(Duration.ofDays(2));
        store.write(report("p2", BASE, 1.0));
        clock.advance(Duration.ofDays(6));
        store.write(report("p1", BASE.minus(Duration.ofDays(30)), 1.0));

        assertThat(store.cleanup(7)).isEqualTo(1);
        assertThat(table.rowKeys()).containsExactly(
                "p1#2025-12-25T12:00:00.000000Z",
                "p2#2026-01-24T12:00:00.000000Z"
        );
        assertThat(store.cleanup(7)).isZero();
    }

    @Test
    void testCleanupZeroDaysDeletesEverything() {
        store.write(report("p1", BASE, 1.0));
        store.write(report("p2", BASE.minusSeconds(1), 1.0));

        assertThat(store.cleanup(0)).isEqualTo(2);
        assertThat(table.rowCount()).isZero();
    }

    /**
     * A producer clock running ahead of the server does not keep its rows alive.
     */
    @Test
    void testCleanupZeroDaysDeletesFutureDatedRows() {
        store.write(report("p1", BASE.plusSeconds(5), 1.0));
        store.write(report("p2", BASE.minusSeconds(5), 1.0));

        assertThat(store.cleanup(0)).isEqualTo(2);
        assertThat(store.queryHistory("p1", 24)).isEmpty();
        assertThat(table.rowCount()).isZero();
    }

    @Test
    void testCleanupAgesRowsWithUnparseableKeyByWriteTime() {
        table.mutateRow("legacy#not-a-time", List.of(new CellValue("metrics", "recent_hashrate",
                BASE.toEpochMilli() * 1000, "1.0")));

        assertThat(store.cleanup(1)).isZero();
        clock.advance(Duration.ofDays(1));
        assertThat(store.cleanup(1)).isEqualTo(1);
        assertThat(table.rowCount()).isZero();
    }

    @Test
    void testCleanupRejectsNegativeDays() {
        assertThatThrownBy(() -> store.cleanup(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testProducerIdWithSeparatorRejected() {
        assertThatThrownBy(() -> store.write(report("rig#1", 100, 1.0)))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("separator");
        assertThat(table.rowCount()).isZero();
    }

    @Test
    void testBackendFailuresSurfaceAsPersistenceException() {
        table.setFailing(true);

        assertThatThrownBy(() -> store.write(report("p1", 100, 1.0)))
                .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> store.queryHistory("p1", 24))
                .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> store.queryInstances())
                .isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> store.cleanup(7))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void testUnparseableReportTimestampFallsBackToReceiveTime() {
        Instant received = BASE.plusSeconds(3);
        store.write(report("p1", 100, 1.0).toBuilder()
                .reportTimestamp("yesterday")
                .receivedAt(received)
                .build());

        assertThat(table.rowKeys()).containsExactly("p1#2026-01-24T12:00:03.000000Z");
    }

    @Test
    void testCloseReleasesTable() {
        store.close();

        assertThat(table.isClosed()).isTrue();
    }
}
