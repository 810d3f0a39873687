package com.hashfleet.monitor.registry;

import com.hashfleet.monitor.model.AggregateStats;
import com.hashfleet.monitor.model.DeviceTelemetry;
import com.hashfleet.monitor.model.ProducerReport;
import com.hashfleet.monitor.timeseries.RingStats;
import com.hashfleet.monitor.timeseries.TimeSeriesRing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Live view of the producers that are currently reporting.
 * <p>
 * Liveness is never stored: a producer is active while its last report
 * arrived less than {@code staleThreshold} ago. Entries that fail that filter
 * stay in the map (they come back as soon as the producer reports again)
 * until they pass the much longer {@code hardExpiry} horizon, or until the map
 * exceeds {@code maxEntries}; then they are physically removed.
 * <p>
 * The map is kept in arrival order (re-reporting moves a producer to the tail),
 * so the head is always the least recently heard-from producer and physical
 * eviction on the write path only ever looks at the head.
 * <p>
 * One read/write lock covers the whole map: updates are exclusive with each
 * other and with reads, reads may run in parallel with each other.
 */
@Slf4j
@Component
public class LiveRegistry {

    private final Clock clock;
    private final Duration staleThreshold;
    private final Duration hardExpiry;
    private final int maxEntries;

    /**
     * producer_id -> latest report, ordered by arrival
     */
    private final LinkedHashMap<String, ProducerReport> producers = new LinkedHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * One sample (the producer id) per accepted report.
     */
    private final TimeSeriesRing<String> arrivals;

    public LiveRegistry(
            Clock clock,
            @Value("${registry.stale-threshold-seconds:30}") long staleThresholdSeconds,
            @Value("${registry.hard-expiry-seconds:3600}") long hardExpirySeconds,
            @Value("${registry.max-entries:100000}") int maxEntries,
            @Value("${registry.arrival-window:300}") int arrivalWindow
    ) {
        if (staleThresholdSeconds <= 0) {
            throw new IllegalArgumentException("Stale threshold must be positive");
        }
        if (hardExpirySeconds < staleThresholdSeconds) {
            throw new IllegalArgumentException(
                    "Hard expiry (" + hardExpirySeconds + "s) must not be shorter than the stale threshold ("
                            + staleThresholdSeconds + "s)");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Max entries must be positive");
        }
        this.clock = clock;
        this.staleThreshold = Duration.ofSeconds(staleThresholdSeconds);
        this.hardExpiry = Duration.ofSeconds(hardExpirySeconds);
        this.maxEntries = maxEntries;
        this.arrivals = new TimeSeriesRing<>(arrivalWindow);
        log.info(
                "Initialized LiveRegistry (stale threshold: {}s, hard expiry: {}s, max entries: {})",
                staleThresholdSeconds, hardExpirySeconds, maxEntries
        );
    }

    /**
     * Record the latest report of a producer.
     * <p>
     * Stamps {@code receivedAt} with the current time, overwriting whatever the
     * caller put there, and replaces any earlier entry for the same producer.
     *
     * @param report incoming report, not modified
     * @return the stored copy, carrying the server-assigned {@code receivedAt}
     */
    public ProducerReport update(ProducerReport report) {
        ProducerReport stored;
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            stored = copyOf(report);
            stored.setReceivedAt(now);

            // remove first so that re-reporting moves the producer to the tail
            producers.remove(stored.getProducerId());
            producers.put(stored.getProducerId(), stored);

            evictFromHead(now);
            arrivals.append(now, stored.getProducerId());
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Updated producer {} (received at {})", stored.getProducerId(), stored.getReceivedAt());
        return copyOf(stored);
    }

    /**
     * Producers heard from within the stale threshold.
     * <p>
     * The threshold is evaluated against one {@code now} captured before the
     * scan. Returned reports are copies; callers may mutate them freely.
     */
    public List<ProducerReport> snapshot() {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            List<ProducerReport> active = new ArrayList<>(producers.size());
            for (ProducerReport report : producers.values()) {
                if (isActive(report, now)) {
                    active.add(copyOf(report));
                }
            }
            return active;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Aggregates over one {@link #snapshot()}. All zeros when nobody is active.
     */
    public AggregateStats stats() {
        return aggregate(snapshot());
    }

    /**
     * Physically remove entries older than the hard expiry horizon.
     *
     * @return number of removed entries
     */
    @Scheduled(fixedRateString = "${registry.eviction-interval-ms:60000}")
    public int evictExpired() {
        int evicted;
        lock.writeLock().lock();
        try {
            Instant cutoff = clock.instant().minus(hardExpiry);
            int before = producers.size();
            producers.values().removeIf(report -> !report.getReceivedAt().isAfter(cutoff));
            evicted = before - producers.size();
        } finally {
            lock.writeLock().unlock();
        }
        if (evicted > 0) {
            log.info("Evicted {} producers silent for more than {}s", evicted, hardExpiry.toSeconds());
        }
        return evicted;
    }

    /**
     * @return number of entries physically held, active or not
     */
    public int size() {
        lock.readLock().lock();
        try {
            return producers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Report arrival statistics; {@code ratePerSecond} is reports per second
     * over the arrival window.
     */
    public RingStats arrivalStats() {
        return arrivals.stats(producerId -> 1.0);
    }

    public Duration getStaleThreshold() {
        return staleThreshold;
    }

    public static AggregateStats aggregate(List<ProducerReport> active) {
        if (active.isEmpty()) {
            return AggregateStats.EMPTY;
        }

        double totalRate = 0;
        long totalUnits = 0;
        long totalDevices = 0;
        for (ProducerReport report : active) {
            totalRate += report.getRecentRate();
            totalUnits += report.getTotalUnits();
            if (report.isDeviceAvailable()) {
                totalDevices += report.getDeviceCount();
            }
        }
        return new AggregateStats(
                active.size(),
                totalRate,
                totalUnits,
                totalDevices,
                totalRate / active.size()
        );
    }

    private boolean isActive(ProducerReport report, Instant now) {
        return Duration.between(report.getReceivedAt(), now).compareTo(staleThreshold) < 0;
    }

    /**
     * Caller must hold the write lock.
     */
    private void evictFromHead(Instant now) {
        Instant cutoff = now.minus(hardExpiry);
        Iterator<Map.Entry<String, ProducerReport>> it = producers.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ProducerReport> head = it.next();
            boolean expired = !head.getValue().getReceivedAt().isAfter(cutoff);
            if (!expired && producers.size() <= maxEntries) {
                break;
            }
            it.remove();
            log.debug("Evicted producer {} ({})", head.getKey(), expired ? "expired" : "capacity");
        }
    }

    private static ProducerReport copyOf(ProducerReport report) {
        DeviceTelemetry device = report.getDevice();
        return report.toBuilder()
                .device(device == null ? null : device.toBuilder().build())
                .build();
    }
}
