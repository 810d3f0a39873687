package com.hashfleet.monitor.timeseries;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Fixed-capacity rolling window over timestamped samples.
 * <p>
 * Append-only: once the ring is full, every append evicts the oldest sample.
 * Statistics are derived on demand from whatever is currently held.
 * <p>
 * All methods are synchronized on the ring itself, so one instance can be
 * shared between a scheduled writer and any number of request threads.
 *
 * @param <T> sample payload
 */
public class TimeSeriesRing<T> {

    private final int capacity;
    private final ArrayDeque<Sample<T>> samples;

    public TimeSeriesRing(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Ring capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    /**
     * Append a sample, evicting the oldest one when the ring is full.
     */
    public synchronized void append(Instant timestamp, T value) {
        if (samples.size() == capacity) {
            samples.pollFirst();
        }
        samples.addLast(new Sample<>(timestamp, value));
    }

    /**
     * @return copy of the held samples, oldest first
     */
    public synchronized List<Sample<T>> samples() {
        return new ArrayList<>(samples);
    }

    /**
     * @return up to {@code n} most recent values, oldest first
     */
    public synchronized List<T> lastValues(int n) {
        int skip = Math.max(0, samples.size() - n);
        List<T> result = new ArrayList<>(Math.min(n, samples.size()));
        Iterator<Sample<T>> it = samples.iterator();
        int index = 0;
        while (it.hasNext()) {
            Sample<T> sample = it.next();
            if (index++ >= skip) {
                result.add(sample.value());
            }
        }
        return result;
    }

    public synchronized int size() {
        return samples.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized Optional<Sample<T>> latest() {
        return Optional.ofNullable(samples.peekLast());
    }

    public synchronized Optional<Sample<T>> earliest() {
        return Optional.ofNullable(samples.peekFirst());
    }

    /**
     * Wall-clock distance between the oldest and the newest sample.
     * Zero when fewer than two samples are held.
     */
    public synchronized Duration span() {
        if (samples.size() < 2) {
            return Duration.ZERO;
        }
        return Duration.between(samples.peekFirst().timestamp(), samples.peekLast().timestamp());
    }

    /**
     * Aggregate one numeric dimension of the held samples.
     */
    public synchronized RingStats stats(ToDoubleFunction<T> metric) {
        if (samples.isEmpty()) {
            return RingStats.EMPTY;
        }

        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Sample<T> sample : samples) {
            double v = metric.applyAsDouble(sample.value());
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        int count = samples.size();
        double spanSeconds = spanSeconds();
        return new RingStats(
                count,
                sum,
                min,
                max,
                sum / count,
                spanSeconds,
                spanSeconds > 0 ? sum / spanSeconds : 0
        );
    }

    /**
     * Difference of a (monotonic) dimension between the newest and the oldest sample.
     */
    public synchronized double delta(ToDoubleFunction<T> metric) {
        if (samples.size() < 2) {
            return 0;
        }
        return metric.applyAsDouble(samples.peekLast().value())
                - metric.applyAsDouble(samples.peekFirst().value());
    }

    private double spanSeconds() {
        return span().toNanos() / 1_000_000_000.0;
    }

    /**
     * One timestamped entry of the ring.
     */
    public record Sample<T>(Instant timestamp, T value) {}
}
