package com.hashfleet.monitor.web;

import com.hashfleet.monitor.model.AggregateStats;
import com.hashfleet.monitor.registry.LiveRegistry;
import com.hashfleet.monitor.storage.HistoryRecord;
import com.hashfleet.monitor.storage.HistoryStore;
import com.hashfleet.monitor.storage.HistorySummary;
import com.hashfleet.monitor.storage.PersistenceException;
import com.hashfleet.monitor.storage.StoredInstance;
import com.hashfleet.monitor.storage.SummaryWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side over the history store for the HTTP layer.
 * <p>
 * History problems never fail a query: a backend read error is logged and
 * answered with an empty result, so the live part of the dashboard keeps working.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryQueryService {

    static final int SUMMARY_HOURS = 24;

    private final HistoryStore historyStore;
    private final LiveRegistry registry;

    public List<HistoryRecord> history(String producerId, int hours) {
        try {
            return historyStore.queryHistory(producerId, hours);
        } catch (PersistenceException e) {
            log.error("Error fetching history of {}: {}", producerId, e.getMessage());
            return List.of();
        }
    }

    /**
     * @throws UnsupportedOperationException when the active backend cannot reconstruct instances
     */
    public List<StoredInstance> storedInstances() {
        try {
            return historyStore.queryInstances();
        } catch (PersistenceException e) {
            log.error("Error fetching stored instances: {}", e.getMessage());
            return List.of();
        }
    }

    public FleetSummary summary() {
        AggregateStats stats = registry.stats();
        FleetSummary.Current current = new FleetSummary.Current(
                stats.instanceCount(),
                stats.totalRate(),
                stats.totalDevices(),
                stats.avgRate()
        );

        HistorySummary lastDay;
        try {
            lastDay = historyStore.querySummary(SUMMARY_HOURS);
        } catch (PersistenceException e) {
            log.error("Error generating summary: {}", e.getMessage());
            lastDay = HistorySummary.empty(SUMMARY_HOURS, SummaryWindow.UNAVAILABLE);
        }
        return new FleetSummary(current, lastDay);
    }
}
