package com.hashfleet.monitor.storage;

import com.hashfleet.monitor.model.ProducerReport;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Stand-in used when the configured backend failed to start.
 * <p>
 * Reads answer empty so the live dashboard keeps working without history;
 * writes still fail so the ingest path reports the outage.
 */
@Slf4j
public class UnavailableHistoryStore implements HistoryStore {

    private final String backend;
    private final String reason;

    public UnavailableHistoryStore(String backend, String reason) {
        this.backend = backend;
        this.reason = reason;
        log.warn("History backend '{}' unavailable ({}), running without persistence", backend, reason);
    }

    @Override
    public void write(ProducerReport report) {
        throw new PersistenceException("History backend '" + backend + "' is unavailable: " + reason);
    }

    @Override
    public List<HistoryRecord> queryHistory(String producerId, int hours) {
        return List.of();
    }

    @Override
    public List<StoredInstance> queryInstances() {
        return List.of();
    }

    @Override
    public HistorySummary querySummary(int hours) {
        return HistorySummary.empty(hours, SummaryWindow.UNAVAILABLE);
    }

    @Override
    public int cleanup(int retentionDays) {
        return 0;
    }

    @Override
    public String backendName() {
        return backend + " (unavailable)";
    }
}
