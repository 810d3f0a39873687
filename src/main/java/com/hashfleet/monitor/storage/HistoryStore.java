package com.hashfleet.monitor.storage;

import com.hashfleet.monitor.model.ProducerReport;

import java.util.List;

/**
 * Durable, append-only record of every accepted report.
 * <p>
 * Implementations provide their own internal thread safety. Writes never
 * overwrite earlier records on the row store; the wide-column store keys rows
 * by {@code producer_id#timestamp}, so there a second report with the same
 * producer and normalized timestamp lands on the same row and replaces its
 * cells. Reports with distinct timestamps always produce distinct records.
 * <p>
 * Ordering of {@link #queryHistory} results is backend-specific; callers may
 * only rely on every matching record being present exactly once (up to
 * {@link #MAX_HISTORY_ROWS}).
 */
public interface HistoryStore extends AutoCloseable {

    int MAX_HISTORY_ROWS = 1000;

    /**
     * Persist one report as a new record.
     *
     * @throws PersistenceException if the record cannot be committed
     */
    void write(ProducerReport report);

    /**
     * Records of one producer newer than {@code now - hours}, at most
     * {@link #MAX_HISTORY_ROWS}; the oldest are dropped first.
     *
     * @throws PersistenceException on backend read failure
     */
    List<HistoryRecord> queryHistory(String producerId, int hours);

    /**
     * One synthesized entry per producer ever persisted.
     * <p>
     * Only the wide-column backend answers this; its entries are merged per
     * field (last write wins per cell), so one entry may combine values coming
     * from different reports.
     *
     * @throws UnsupportedOperationException on the row-store backend, use the live registry instead
     * @throws PersistenceException          on backend read failure
     */
    List<StoredInstance> queryInstances();

    /**
     * Fleet summary over the last {@code hours}.
     * <p>
     * {@link HistorySummary#window()} tells how it was computed: the row store
     * aggregates the trailing window, the wide-column store summarizes
     * {@link #queryInstances()} and ignores {@code hours}.
     *
     * @throws PersistenceException on backend read failure
     */
    HistorySummary querySummary(int hours);

    /**
     * Delete every record older than {@code retentionDays}.
     * Idempotent; a record written during the sweep may or may not be deleted.
     *
     * @return number of deleted records, never negative
     * @throws PersistenceException on backend failure
     */
    int cleanup(int retentionDays);

    String backendName();

    @Override
    default void close() {
        // nothing to release by default
    }
}
