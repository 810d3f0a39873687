package com.hashfleet.monitor.retention;

import com.hashfleet.monitor.storage.HistoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Recurring deletion of history older than the retention horizon.
 * <p>
 * Works against whichever {@link HistoryStore} is active. A failed sweep is
 * logged and the next one still runs.
 */
@Slf4j
@Component
public class RetentionSweeper {

    private final HistoryStore historyStore;
    private final int retentionDays;

    private final AtomicLong sweeps = new AtomicLong();
    private final AtomicLong failedSweeps = new AtomicLong();
    private final AtomicLong recordsDeleted = new AtomicLong();

    public RetentionSweeper(
            HistoryStore historyStore,
            @Value("${retention.days:7}") int retentionDays
    ) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("Retention days must not be negative");
        }
        this.historyStore = historyStore;
        this.retentionDays = retentionDays;
        log.info("Initialized RetentionSweeper ({} days on {})", retentionDays, historyStore.backendName());
    }

    /**
     * Run one sweep.
     *
     * @return number of deleted records, 0 when the sweep failed
     */
    @Scheduled(
            initialDelayString = "${retention.sweep-interval-ms:3600000}",
            fixedRateString = "${retention.sweep-interval-ms:3600000}"
    )
    public int sweep() {
        sweeps.incrementAndGet();
        try {
            int deleted = historyStore.cleanup(retentionDays);
            recordsDeleted.addAndGet(deleted);
            log.debug("Retention sweep removed {} records", deleted);
            return deleted;
        } catch (RuntimeException e) {
            failedSweeps.incrementAndGet();
            SweepException failure = new SweepException(
                    "Retention sweep on " + historyStore.backendName() + " failed", e);
            log.error("Error cleaning up old records", failure);
            return 0;
        }
    }

    public long getSweepCount() {
        return sweeps.get();
    }

    public long getFailedSweepCount() {
        return failedSweeps.get();
    }

    public long getRecordsDeleted() {
        return recordsDeleted.get();
    }
}
