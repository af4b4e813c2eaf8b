package com.example.skirmish.event;

/**
 * Tuning for the {@link CombatEventBus}. These change dispatch latency and
 * per-tick cost, never ordering or delivery.
 */
public class EventBusConfig {

    public static final long DEFAULT_THROTTLE_INTERVAL_MS = 10;
    public static final int DEFAULT_LOG_CAPACITY = 256;
    public static final int DEFAULT_BATCH_SIZE = 16;

    private final long throttleIntervalMs;
    private final int logCapacity;
    private final int batchSize;

    public EventBusConfig(long throttleIntervalMs, int logCapacity, int batchSize) {
        if (throttleIntervalMs <= 0) {
            throw new IllegalArgumentException("throttleIntervalMs must be positive: " + throttleIntervalMs);
        }
        if (logCapacity <= 0) {
            throw new IllegalArgumentException("logCapacity must be positive: " + logCapacity);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.throttleIntervalMs = throttleIntervalMs;
        this.logCapacity = logCapacity;
        this.batchSize = batchSize;
    }

    public static EventBusConfig defaults() {
        return new EventBusConfig(DEFAULT_THROTTLE_INTERVAL_MS, DEFAULT_LOG_CAPACITY, DEFAULT_BATCH_SIZE);
    }

    public long getThrottleIntervalMs() { return throttleIntervalMs; }
    public int getLogCapacity() { return logCapacity; }
    public int getBatchSize() { return batchSize; }

    @Override
    public String toString() {
        return String.format("EventBusConfig[throttle=%dms, logCapacity=%d, batchSize=%d]",
            throttleIntervalMs, logCapacity, batchSize);
    }
}
