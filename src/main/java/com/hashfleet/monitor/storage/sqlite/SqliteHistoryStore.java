package com.hashfleet.monitor.storage.sqlite;

import com.hashfleet.monitor.model.DeviceTelemetry;
import com.hashfleet.monitor.model.ProducerReport;
import com.hashfleet.monitor.storage.BackendUnavailableException;
import com.hashfleet.monitor.storage.HistoryRecord;
import com.hashfleet.monitor.storage.HistoryStore;
import com.hashfleet.monitor.storage.HistorySummary;
import com.hashfleet.monitor.storage.PersistenceException;
import com.hashfleet.monitor.storage.RecordTimestamps;
import com.hashfleet.monitor.storage.StoredInstance;
import com.hashfleet.monitor.storage.SummaryWindow;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Row-store history backend on an embedded SQLite file.
 * <p>
 * One table, one row per accepted report: every write appends, even when a
 * producer sends the same timestamp twice. Retention is enforced on
 * {@code created_at}, the server time at which the row was written.
 * <p>
 * A single connection is shared; every statement runs under the store's monitor.
 */
@Slf4j
public class SqliteHistoryStore implements HistoryStore {

    private static final String INSERT_SQL = """
            INSERT INTO hashrate_history
            (instance_id, total_hashes, overall_hashrate, recent_hashrate, gpu_count, gpu_available,
             ip_address, hashrate, temperature, gpu_name, power, efficiency, timestamp, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String HISTORY_SQL = """
            SELECT instance_id, timestamp, recent_hashrate, overall_hashrate, total_hashes, gpu_count,
                   temperature, power
            FROM hashrate_history
            WHERE instance_id = ? AND timestamp > ?
            ORDER BY timestamp DESC
            LIMIT ?
            """;

    private static final String SUMMARY_SQL = """
            SELECT COUNT(DISTINCT instance_id) AS unique_instances,
                   SUM(total_hashes)           AS total_hashes,
                   AVG(recent_hashrate)        AS avg_hashrate,
                   MAX(recent_hashrate)        AS peak_hashrate
            FROM hashrate_history
            WHERE timestamp > ?
            """;

    private static final String CLEANUP_SQL = "DELETE FROM hashrate_history WHERE created_at <= ?";

    private final String databasePath;
    private final Clock clock;
    private final Connection connection;
    private final PreparedStatement insertStatement;
    private final AtomicLong writeCount = new AtomicLong(0);

    /**
     * Open (and create if needed) the database file.
     *
     * @throws BackendUnavailableException if the file cannot be opened or the schema created
     */
    public SqliteHistoryStore(String databasePath, Clock clock) {
        this.databasePath = databasePath;
        this.clock = clock;
        log.info("Initializing SQLite history store with database: {}", databasePath);

        File parent = new File(databasePath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new BackendUnavailableException("Cannot create database directory " + parent);
        }

        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath);
            connection.setAutoCommit(true); // each write is immediately committed
            createSchema();
            insertStatement = connection.prepareStatement(INSERT_SQL);
        } catch (SQLException e) {
            throw new BackendUnavailableException("Cannot open SQLite database " + databasePath, e);
        }

        log.info("SQLite history store initialized");
    }

    private void createSchema() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("""
                    CREATE TABLE IF NOT EXISTS hashrate_history (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        instance_id TEXT NOT NULL,
                        total_hashes INTEGER,
                        overall_hashrate REAL,
                        recent_hashrate REAL,
                        gpu_count INTEGER,
                        gpu_available BOOLEAN,
                        ip_address TEXT,
                        hashrate REAL,
                        temperature REAL,
                        gpu_name TEXT,
                        power REAL,
                        efficiency REAL,
                        timestamp TEXT NOT NULL,
                        created_at TEXT NOT NULL
                    )
                    """);
            stmt.execute("""
                    CREATE INDEX IF NOT EXISTS idx_instance_timestamp
                    ON hashrate_history(instance_id, timestamp DESC)
                    """);
            stmt.execute("""
                    CREATE INDEX IF NOT EXISTS idx_created_at
                    ON hashrate_history(created_at)
                    """);
            log.info("Table 'hashrate_history' created or already exists");
        }
    }

    @Override
    public synchronized void write(ProducerReport report) {
        Instant now = clock.instant();
        Instant receivedAt = report.getReceivedAt() != null ? report.getReceivedAt() : now;
        String timestamp = RecordTimestamps.format(
                RecordTimestamps.resolve(report.getReportTimestamp(), receivedAt)
        );
        DeviceTelemetry device = report.getDevice() != null ? report.getDevice() : new DeviceTelemetry();

        try {
            insertStatement.setString(1, report.getProducerId());
            insertStatement.setLong(2, report.getTotalUnits());
            insertStatement.setDouble(3, report.getLifetimeRate());
            insertStatement.setDouble(4, report.getRecentRate());
            insertStatement.setInt(5, report.getDeviceCount());
            insertStatement.setBoolean(6, report.isDeviceAvailable());
            insertStatement.setString(7, report.getOriginAddress());
            setNullableDouble(8, device.getHashrate());
            setNullableDouble(9, device.getTemperature());
            insertStatement.setString(10, device.getName());
            setNullableDouble(11, device.getPower());
            setNullableDouble(12, device.getEfficiency());
            insertStatement.setString(13, timestamp);
            insertStatement.setString(14, RecordTimestamps.format(now));

            insertStatement.executeUpdate();
            long count = writeCount.incrementAndGet();

            log.debug("Written report of {} at {} (total writes: {})", report.getProducerId(), timestamp, count);

        } catch (SQLException e) {
            log.error("Failed to write report of {} at {}", report.getProducerId(), timestamp, e);
            throw new PersistenceException("Database write failed", e);
        }
    }

    @Override
    public synchronized List<HistoryRecord> queryHistory(String producerId, int hours) {
        String cutoff = RecordTimestamps.format(clock.instant().minus(Duration.ofHours(hours)));
        try (PreparedStatement stmt = connection.prepareStatement(HISTORY_SQL)) {
            stmt.setString(1, producerId);
            stmt.setString(2, cutoff);
            stmt.setInt(3, MAX_HISTORY_ROWS);

            List<HistoryRecord> history = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    history.add(new HistoryRecord(
                            rs.getString("instance_id"),
                            rs.getString("timestamp"),
                            rs.getDouble("recent_hashrate"),
                            rs.getDouble("overall_hashrate"),
                            rs.getLong("total_hashes"),
                            rs.getInt("gpu_count"),
                            getNullableDouble(rs, "temperature"),
                            getNullableDouble(rs, "power")
                    ));
                }
            }
            return history;
        } catch (SQLException e) {
            log.error("Failed to read history of {}", producerId, e);
            throw new PersistenceException("Database read failed", e);
        }
    }

    /**
     * Not available on the row store: the live registry is the source for
     * current per-producer state.
     */
    @Override
    public List<StoredInstance> queryInstances() {
        throw new UnsupportedOperationException(
                "Row-store backend does not reconstruct instances, use the live registry");
    }

    @Override
    public synchronized HistorySummary querySummary(int hours) {
        String cutoff = RecordTimestamps.format(clock.instant().minus(Duration.ofHours(hours)));
        try (PreparedStatement stmt = connection.prepareStatement(SUMMARY_SQL)) {
            stmt.setString(1, cutoff);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return HistorySummary.empty(hours, SummaryWindow.TRAILING_WINDOW);
                }
                // aggregates are NULL over an empty window; getXxx maps them to 0
                return new HistorySummary(
                        rs.getLong("unique_instances"),
                        rs.getLong("total_hashes"),
                        rs.getDouble("avg_hashrate"),
                        rs.getDouble("peak_hashrate"),
                        hours,
                        SummaryWindow.TRAILING_WINDOW
                );
            }
        } catch (SQLException e) {
            log.error("Failed to compute {}h summary", hours, e);
            throw new PersistenceException("Database read failed", e);
        }
    }

    @Override
    public synchronized int cleanup(int retentionDays) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("Retention days must not be negative");
        }
        String cutoff = RecordTimestamps.format(clock.instant().minus(Duration.ofDays(retentionDays)));
        try (PreparedStatement stmt = connection.prepareStatement(CLEANUP_SQL)) {
            stmt.setString(1, cutoff);
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                log.info("Cleaned up {} records older than {} days", deleted, retentionDays);
            }
            return deleted;
        } catch (SQLException e) {
            log.error("Failed to clean up records older than {} days", retentionDays, e);
            throw new PersistenceException("Database cleanup failed", e);
        }
    }

    @Override
    public String backendName() {
        return "sqlite";
    }

    /**
     * Get the total number of writes performed.
     */
    public long getWriteCount() {
        return writeCount.get();
    }

    @Override
    public synchronized void close() {
        try {
            insertStatement.close();
            connection.close();
            log.info("SQLite history store {} closed (total writes: {})", databasePath, writeCount.get());
        } catch (SQLException e) {
            log.error("Error closing SQLite history store", e);
        }
    }

    private void setNullableDouble(int index, Double value) throws SQLException {
        if (value == null) {
            insertStatement.setNull(index, Types.REAL);
        } else {
            insertStatement.setDouble(index, value);
        }
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
