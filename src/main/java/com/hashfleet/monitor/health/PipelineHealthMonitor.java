package com.hashfleet.monitor.health;

import com.hashfleet.monitor.timeseries.TimeSeriesRing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Health of the ingestion pipeline, fed by metric pushes.
 * <p>
 * Every push is checked against the thresholds and each breach appends one
 * alert; repeated breaches produce repeated alerts. Independently of pushes,
 * {@link #tick()} runs on a fixed rate and appends one snapshot of gauges and
 * counters to a bounded ring used for the trailing trend.
 */
@Slf4j
@Component
public class PipelineHealthMonitor {

    private static final int RECENT_ALERTS = 10;

    private final Clock clock;
    private final AlertThresholds thresholds;
    private final int nominalBatchSize;

    private final AtomicLong totalWrites = new AtomicLong();
    private final AtomicLong failedWrites = new AtomicLong();
    private final AtomicLong totalRetries = new AtomicLong();
    private final AtomicLong totalBatches = new AtomicLong();
    private final AtomicLong messagesBuffered = new AtomicLong();
    private final AtomicLong messagesProcessed = new AtomicLong();

    /**
     * Guarded by itself.
     */
    private final PipelineGauges gauges = new PipelineGauges();

    private final TimeSeriesRing<PipelineMetricsSnapshot> history;
    private final TimeSeriesRing<AlertRecord> alerts;

    public PipelineHealthMonitor(
            Clock clock,
            AlertThresholds thresholds,
            @Value("${monitor.window-size:300}") int windowSize,
            @Value("${monitor.alert-capacity:100}") int alertCapacity,
            @Value("${monitor.nominal-batch-size:5000}") int nominalBatchSize
    ) {
        if (nominalBatchSize <= 0) {
            throw new IllegalArgumentException("Nominal batch size must be positive");
        }
        this.clock = clock;
        this.thresholds = thresholds;
        this.nominalBatchSize = nominalBatchSize;
        this.history = new TimeSeriesRing<>(windowSize);
        this.alerts = new TimeSeriesRing<>(alertCapacity);
        log.info("Initialized PipelineHealthMonitor (window: {}, thresholds: {})", windowSize, thresholds);
    }

    /* ---------- Metric pushes ---------- */

    public void updateStoreMetrics(double writesPerSecond, double latencyMs, double errorRate,
                                   Map<String, Long> shardDistribution) {
        synchronized (gauges) {
            gauges.setStoreWritesPerSecond(writesPerSecond);
            gauges.setStoreWriteLatencyMs(latencyMs);
            gauges.setStoreErrorRate(errorRate);
            gauges.setShardDistribution(shardDistribution != null ? Map.copyOf(shardDistribution) : Map.of());
        }
        totalWrites.addAndGet((long) writesPerSecond);

        if (latencyMs > thresholds.writeLatencyMs()) {
            raise(AlertSeverity.WARNING, format("High write latency: %.1fms", latencyMs));
        }
        if (errorRate > thresholds.errorRate()) {
            raise(AlertSeverity.CRITICAL, format("High error rate: %.2f%%", errorRate * 100));
        }
    }

    public void updateBufferMetrics(long queueDepth, double lagSeconds, long buffered) {
        synchronized (gauges) {
            gauges.setBufferQueueDepth(queueDepth);
            gauges.setBufferLagSeconds(lagSeconds);
        }
        messagesBuffered.addAndGet(buffered);

        if (queueDepth > thresholds.queueDepth()) {
            raise(AlertSeverity.WARNING, format("Buffer queue backup: %d messages", queueDepth));
        }
        if (lagSeconds > thresholds.bufferLagSeconds()) {
            raise(AlertSeverity.WARNING, format("High buffer lag: %.1fs", lagSeconds));
        }
    }

    public void updateWorkerMetrics(int poolSize, double utilization, double batchEfficiency) {
        synchronized (gauges) {
            gauges.setWorkerPoolSize(poolSize);
            gauges.setWorkerUtilization(utilization);
            gauges.setBatchEfficiency(batchEfficiency);
        }

        if (utilization > thresholds.workerUtilization()) {
            raise(AlertSeverity.INFO, format("High worker utilization: %.1f%%", utilization * 100));
        }
    }

    /**
     * Record the outcome of one batch write.
     */
    public void recordBatch(int batchSize, boolean success, int retries) {
        long batches = totalBatches.incrementAndGet();
        messagesProcessed.addAndGet(batchSize);
        if (!success) {
            failedWrites.addAndGet(batchSize);
        }
        if (retries > 0) {
            long retriesSoFar = totalRetries.addAndGet(retries);
            synchronized (gauges) {
                gauges.setRetryRate((double) retriesSoFar / Math.max(1, batches));
            }
        }
    }

    /**
     * Dispatch every category present in a push.
     */
    public void apply(PipelineUpdate update) {
        if (update.getStore() != null) {
            PipelineUpdate.StoreMetrics m = update.getStore();
            updateStoreMetrics(m.getWritesPerSecond(), m.getLatencyMs(), m.getErrorRate(), m.getShardStats());
        }
        if (update.getBuffer() != null) {
            PipelineUpdate.BufferMetrics m = update.getBuffer();
            updateBufferMetrics(m.getQueueDepth(), m.getLagSeconds(), m.getMessagesBuffered());
        }
        if (update.getWorkers() != null) {
            PipelineUpdate.WorkerMetrics m = update.getWorkers();
            updateWorkerMetrics(m.getPoolSize(), m.getUtilization(), m.getBatchEfficiency());
        }
        if (update.getBatch() != null) {
            PipelineUpdate.BatchOutcome m = update.getBatch();
            recordBatch(m.getSize(), !Boolean.FALSE.equals(m.getSuccess()), m.getRetries());
        }
    }

    /* ---------- Background snapshot ---------- */

    /**
     * Recompute derived gauges and append one snapshot, whether or not any
     * metric arrived since the previous tick.
     */
    @Scheduled(
            initialDelayString = "${monitor.snapshot-interval-ms:5000}",
            fixedRateString = "${monitor.snapshot-interval-ms:5000}"
    )
    public void tick() {
        try {
            PipelineCounters counters = counters();
            if (counters.totalBatches() > 0) {
                double efficiency = (double) counters.messagesProcessed()
                        / ((double) counters.totalBatches() * nominalBatchSize);
                synchronized (gauges) {
                    gauges.setBatchEfficiency(efficiency);
                }
            }
            Instant now = clock.instant();
            history.append(now, new PipelineMetricsSnapshot(now, currentGauges(), counters));
            log.debug("Pipeline snapshot taken ({} in window)", history.size());
        } catch (RuntimeException e) {
            log.error("Pipeline snapshot failed", e);
        }
    }

    /* ---------- Read side ---------- */

    public PipelineMetricsView metrics() {
        return new PipelineMetricsView(
                currentGauges(),
                counters(),
                alerts.lastValues(RECENT_ALERTS),
                trend()
        );
    }

    /**
     * All retained alerts, oldest first.
     */
    public List<AlertRecord> alerts() {
        return alerts.lastValues(alerts.capacity());
    }

    public List<PipelineMetricsSnapshot> snapshots() {
        return history.lastValues(history.capacity());
    }

    public PipelineCounters counters() {
        return new PipelineCounters(
                totalWrites.get(),
                failedWrites.get(),
                totalRetries.get(),
                totalBatches.get(),
                messagesBuffered.get(),
                messagesProcessed.get()
        );
    }

    public PipelineGauges currentGauges() {
        synchronized (gauges) {
            PipelineGauges copy = gauges.toBuilder().build();
            copy.setShardDistribution(gauges.getShardDistribution() != null
                    ? new HashMap<>(gauges.getShardDistribution())
                    : Map.of());
            return copy;
        }
    }

    /**
     * Trailing figures over the snapshot ring; rates and span are zero until
     * two snapshots were taken.
     */
    PipelineTrend trend() {
        double spanSeconds = history.span().toMillis() / 1000.0;
        double writesInWindow = history.delta(snapshot -> snapshot.counters().totalWrites());
        long processed = messagesProcessed.get();
        return new PipelineTrend(
                spanSeconds > 0 ? writesInWindow / spanSeconds : 0,
                processed,
                1 - (double) failedWrites.get() / Math.max(1, processed),
                spanSeconds,
                history.size()
        );
    }

    private void raise(AlertSeverity severity, String message) {
        Instant now = clock.instant();
        alerts.append(now, new AlertRecord(now, severity, message));
        log.warn("Pipeline alert [{}]: {}", severity.label(), message);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
