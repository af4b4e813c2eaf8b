package com.example.skirmish.util;

import com.example.skirmish.pipeline.PerformanceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * In-memory performance monitor. Keeps the start time of each open span and
 * aggregates closed spans per action kind.
 */
public class TimingMonitor implements PerformanceMonitor {

    private static final Logger logger = LoggerFactory.getLogger(TimingMonitor.class);

    private final Map<String, Long> openSpans = new ConcurrentHashMap<>();
    private final Map<String, Stats> statsByKind = new ConcurrentHashMap<>();
    private final LongSupplier nanoClock;

    public TimingMonitor() {
        this(System::nanoTime);
    }

    public TimingMonitor(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    @Override
    public void startTiming(String key) {
        if (key == null) return;
        Long previous = openSpans.put(key, nanoClock.getAsLong());
        if (previous != null) {
            logger.warn("[TimingMonitor] Span {} restarted before it was stopped", key);
        }
    }

    @Override
    public void stopTiming(String key, String actionKind) {
        if (key == null) return;
        Long startedAt = openSpans.remove(key);
        if (startedAt == null) {
            logger.warn("[TimingMonitor] No open span for {}", key);
            return;
        }
        long elapsed = nanoClock.getAsLong() - startedAt;
        String kind = actionKind != null ? actionKind : "unknown";
        statsByKind.computeIfAbsent(kind, k -> new Stats()).record(elapsed);
        if (logger.isDebugEnabled()) {
            logger.debug("[TimingMonitor] {} took {} us", key, elapsed / 1_000);
        }
    }

    public int openSpanCount() {
        return openSpans.size();
    }

    public boolean isOpen(String key) {
        return key != null && openSpans.containsKey(key);
    }

    /**
     * @return a snapshot of the stats for an action kind, or null if none were recorded
     */
    public Snapshot getStats(String actionKind) {
        Stats stats = statsByKind.get(actionKind);
        return stats == null ? null : stats.snapshot();
    }

    /**
     * Aggregated span durations for one action kind.
     */
    public record Snapshot(long count, long totalNanos, long maxNanos) {
        public double averageMillis() {
            return count == 0 ? 0 : (totalNanos / (double) count) / 1_000_000.0;
        }
    }

    private static class Stats {
        private long count;
        private long totalNanos;
        private long maxNanos;

        synchronized void record(long nanos) {
            count++;
            totalNanos += nanos;
            maxNanos = Math.max(maxNanos, nanos);
        }

        synchronized Snapshot snapshot() {
            return new Snapshot(count, totalNanos, maxNanos);
        }
    }
}
