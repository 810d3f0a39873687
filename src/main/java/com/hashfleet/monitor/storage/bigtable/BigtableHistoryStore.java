package com.hashfleet.monitor.storage.bigtable;

import com.hashfleet.monitor.model.DeviceTelemetry;
import com.hashfleet.monitor.model.ProducerReport;
import com.hashfleet.monitor.storage.HistoryRecord;
import com.hashfleet.monitor.storage.HistoryStore;
import com.hashfleet.monitor.storage.HistorySummary;
import com.hashfleet.monitor.storage.PersistenceException;
import com.hashfleet.monitor.storage.RecordTimestamps;
import com.hashfleet.monitor.storage.StoredInstance;
import com.hashfleet.monitor.storage.SummaryWindow;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Wide-column history backend.
 * <p>
 * Row key is {@code producer_id#timestamp} with a fixed-width UTC timestamp,
 * so a prefix scan over {@code producer_id#} returns exactly that producer's
 * history in chronological order, and the record time can always be read back
 * from the key. Cells are grouped in three families: {@code instance},
 * {@code metrics} and {@code gpu} (optional device readings, only written when
 * present). Two reports of one producer with the same normalized timestamp
 * share a row key, so the second one replaces the cells of the first.
 * <p>
 * Retention ages a row by the newest write time of its cells, which is
 * server time, so producer clock skew does not keep rows alive.
 * <p>
 * There is no server-side aggregation: {@link #queryInstances()} merges cells
 * client-side and {@link #querySummary(int)} is computed from that merge.
 */
@Slf4j
public class BigtableHistoryStore implements HistoryStore {

    public static final String KEY_SEPARATOR = "#";

    public static final String FAMILY_INSTANCE = "instance";
    public static final String FAMILY_METRICS = "metrics";
    public static final String FAMILY_GPU = "gpu";
    public static final List<String> FAMILIES = List.of(FAMILY_INSTANCE, FAMILY_METRICS, FAMILY_GPU);

    private final WideColumnTable table;
    private final Clock clock;

    public BigtableHistoryStore(WideColumnTable table, Clock clock) {
        this.table = table;
        this.clock = clock;
    }

    public static String rowKey(String producerId, String timestamp) {
        return producerId + KEY_SEPARATOR + timestamp;
    }

    @Override
    public void write(ProducerReport report) {
        String producerId = report.getProducerId();
        if (producerId.contains(KEY_SEPARATOR)) {
            throw new PersistenceException(
                    "Producer id '" + producerId + "' contains the row key separator '" + KEY_SEPARATOR + "'");
        }

        Instant now = clock.instant();
        Instant receivedAt = report.getReceivedAt() != null ? report.getReceivedAt() : now;
        String timestamp = RecordTimestamps.format(
                RecordTimestamps.resolve(report.getReportTimestamp(), receivedAt)
        );
        // Bigtable rejects sub-millisecond cell timestamps by default
        long cellTime = now.toEpochMilli() * 1000;

        List<CellValue> cells = new ArrayList<>();
        cells.add(new CellValue(FAMILY_INSTANCE, "id", cellTime, producerId));
        cells.add(new CellValue(FAMILY_INSTANCE, "timestamp", cellTime, timestamp));
        cells.add(new CellValue(FAMILY_INSTANCE, "gpu_count", cellTime, String.valueOf(report.getDeviceCount())));
        cells.add(new CellValue(FAMILY_INSTANCE, "gpu_available", cellTime, String.valueOf(report.isDeviceAvailable())));
        if (report.getOriginAddress() != null) {
            cells.add(new CellValue(FAMILY_INSTANCE, "ip_address", cellTime, report.getOriginAddress()));
        }

        cells.add(new CellValue(FAMILY_METRICS, "total_hashes", cellTime, String.valueOf(report.getTotalUnits())));
        cells.add(new CellValue(FAMILY_METRICS, "overall_hashrate", cellTime, String.valueOf(report.getLifetimeRate())));
        cells.add(new CellValue(FAMILY_METRICS, "recent_hashrate", cellTime, String.valueOf(report.getRecentRate())));

        DeviceTelemetry device = report.getDevice();
        if (device != null) {
            addIfPresent(cells, "hashrate", cellTime, device.getHashrate());
            addIfPresent(cells, "temperature", cellTime, device.getTemperature());
            addIfPresent(cells, "name", cellTime, device.getName());
            addIfPresent(cells, "power", cellTime, device.getPower());
            addIfPresent(cells, "efficiency", cellTime, device.getEfficiency());
        }

        String rowKey = rowKey(producerId, timestamp);
        try {
            table.mutateRow(rowKey, cells);
            log.debug("Written row {}", rowKey);
        } catch (RuntimeException e) {
            log.error("Failed to write row {} to Bigtable", rowKey, e);
            throw new PersistenceException("Bigtable write failed", e);
        }
    }

    /**
     * Ascending by timestamp; when more than {@link #MAX_HISTORY_ROWS} match,
     * the oldest are dropped.
     */
    @Override
    public List<HistoryRecord> queryHistory(String producerId, int hours) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(hours));
        List<HistoryRecord> history = new ArrayList<>();

        try (Stream<WideColumnRow> rows = table.readRows(producerId + KEY_SEPARATOR)) {
            rows.forEach(row -> {
                String timestamp = keyTimestamp(row.key());
                Optional<Instant> recordTime = parseKeyTime(row.key(), timestamp);
                if (recordTime.isEmpty() || !recordTime.get().isAfter(cutoff)) {
                    return;
                }
                history.add(new HistoryRecord(
                        producerId,
                        timestamp,
                        number(row, FAMILY_METRICS, "recent_hashrate", Double::parseDouble).orElse(0.0),
                        number(row, FAMILY_METRICS, "overall_hashrate", Double::parseDouble).orElse(0.0),
                        number(row, FAMILY_METRICS, "total_hashes", Long::parseLong).orElse(0L),
                        number(row, FAMILY_INSTANCE, "gpu_count", Integer::parseInt).orElse(0),
                        number(row, FAMILY_GPU, "temperature", Double::parseDouble).orElse(null),
                        number(row, FAMILY_GPU, "power", Double::parseDouble).orElse(null)
                ));
            });
        } catch (RuntimeException e) {
            log.error("Failed to read history of {} from Bigtable", producerId, e);
            throw new PersistenceException("Bigtable read failed", e);
        }

        history.sort(Comparator.comparing(HistoryRecord::timestamp));
        if (history.size() > MAX_HISTORY_ROWS) {
            return new ArrayList<>(history.subList(history.size() - MAX_HISTORY_ROWS, history.size()));
        }
        return history;
    }

    /**
     * Full scan merging every producer's cells, last write wins per column.
     * <p>
     * The merge is per field, not per record: when cells of two reports were
     * written out of order, the synthesized entry combines fields of both.
     * This is a known approximation of the backend, not corrected here.
     */
    @Override
    public List<StoredInstance> queryInstances() {
        // producer_id -> (family:qualifier -> newest cell)
        Map<String, Map<String, CellValue>> latest = new LinkedHashMap<>();

        try (Stream<WideColumnRow> rows = table.readRows("")) {
            rows.forEach(row -> {
                String producerId = keyProducer(row.key());
                Map<String, CellValue> fields = latest.computeIfAbsent(producerId, id -> new HashMap<>());
                for (CellValue cell : row.cells()) {
                    // ties go to the later row in key order
                    fields.merge(cell.family() + ":" + cell.qualifier(), cell,
                            (existing, incoming) ->
                                    incoming.timestampMicros() >= existing.timestampMicros() ? incoming : existing);
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to scan instances from Bigtable", e);
            throw new PersistenceException("Bigtable read failed", e);
        }

        List<StoredInstance> instances = new ArrayList<>(latest.size());
        latest.forEach((producerId, fields) -> instances.add(toInstance(producerId, fields)));
        return instances;
    }

    /**
     * Summary of the current per-producer state from {@link #queryInstances()}.
     * {@code hours} is not applied; the result is labelled
     * {@link SummaryWindow#CURRENT_SNAPSHOT}.
     */
    @Override
    public HistorySummary querySummary(int hours) {
        List<StoredInstance> instances = queryInstances();
        if (instances.isEmpty()) {
            return HistorySummary.empty(hours, SummaryWindow.CURRENT_SNAPSHOT);
        }

        long totalUnits = 0;
        double rateSum = 0;
        double peakRate = 0;
        for (StoredInstance instance : instances) {
            totalUnits += instance.getTotalUnits();
            rateSum += instance.getRecentRate();
            peakRate = Math.max(peakRate, instance.getRecentRate());
        }
        return new HistorySummary(
                instances.size(),
                totalUnits,
                rateSum / instances.size(),
                peakRate,
                hours,
                SummaryWindow.CURRENT_SNAPSHOT
        );
    }

    /**
     * Full scan deleting rows last written at or before the horizon.
     */
    @Override
    public int cleanup(int retentionDays) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("Retention days must not be negative");
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        List<String> expired = new ArrayList<>();

        try (Stream<WideColumnRow> rows = table.readRows("")) {
            rows.filter(row -> !lastWritten(row).isAfter(cutoff))
                    .forEach(row -> expired.add(row.key()));

            for (String rowKey : expired) {
                table.deleteRow(rowKey);
            }
        } catch (RuntimeException e) {
            log.error("Failed to clean up Bigtable rows older than {} days", retentionDays, e);
            throw new PersistenceException("Bigtable cleanup failed", e);
        }

        log.info("Deleted {} old records from Bigtable", expired.size());
        return expired.size();
    }

    @Override
    public String backendName() {
        return "bigtable";
    }

    @Override
    public void close() {
        table.close();
    }

    private static StoredInstance toInstance(String producerId, Map<String, CellValue> fields) {
        return StoredInstance.builder()
                .producerId(producerId)
                .lastSeen(text(fields, FAMILY_INSTANCE, "timestamp").orElse(null))
                .deviceCount(text(fields, FAMILY_INSTANCE, "gpu_count").map(Integer::parseInt).orElse(0))
                .deviceAvailable(text(fields, FAMILY_INSTANCE, "gpu_available").map(Boolean::parseBoolean).orElse(false))
                .totalUnits(text(fields, FAMILY_METRICS, "total_hashes").map(Long::parseLong).orElse(0L))
                .lifetimeRate(text(fields, FAMILY_METRICS, "overall_hashrate").map(Double::parseDouble).orElse(0.0))
                .recentRate(text(fields, FAMILY_METRICS, "recent_hashrate").map(Double::parseDouble).orElse(0.0))
                .temperature(text(fields, FAMILY_GPU, "temperature").map(Double::parseDouble).orElse(null))
                .deviceName(text(fields, FAMILY_GPU, "name").orElse(null))
                .power(text(fields, FAMILY_GPU, "power").map(Double::parseDouble).orElse(null))
                .efficiency(text(fields, FAMILY_GPU, "efficiency").map(Double::parseDouble).orElse(null))
                .build();
    }

    private static Optional<String> text(Map<String, CellValue> fields, String family, String qualifier) {
        return Optional.ofNullable(fields.get(family + ":" + qualifier)).map(CellValue::value);
    }

    private static <N> Optional<N> number(WideColumnRow row, String family, String qualifier,
                                          Function<String, N> parser) {
        return row.cell(family, qualifier).map(CellValue::value).map(parser);
    }

    private static void addIfPresent(List<CellValue> cells, String qualifier, long cellTime, Object value) {
        if (value != null) {
            cells.add(new CellValue(FAMILY_GPU, qualifier, cellTime, String.valueOf(value)));
        }
    }

    private static Instant lastWritten(WideColumnRow row) {
        long newestMicros = Long.MIN_VALUE;
        for (CellValue cell : row.cells()) {
            newestMicros = Math.max(newestMicros, cell.timestampMicros());
        }
        // a row without cells has nothing left to keep
        return newestMicros == Long.MIN_VALUE ? Instant.EPOCH : Instant.ofEpochMilli(newestMicros / 1000);
    }

    private static String keyProducer(String rowKey) {
        int idx = rowKey.indexOf(KEY_SEPARATOR);
        return idx < 0 ? rowKey : rowKey.substring(0, idx);
    }

    private static String keyTimestamp(String rowKey) {
        int idx = rowKey.indexOf(KEY_SEPARATOR);
        return idx < 0 ? "" : rowKey.substring(idx + 1);
    }

    private static Optional<Instant> parseKeyTime(String rowKey, String timestamp) {
        try {
            return Optional.of(RecordTimestamps.parse(timestamp));
        } catch (DateTimeParseException e) {
            log.error("Error parsing timestamp of row {}", rowKey, e);
            return Optional.empty();
        }
    }
}
