package com.example.skirmish.event;

/**
 * Leaky-bucket limiter for queued dispatch. Elapsed time is accumulated across
 * ticks; a flush is allowed once the accumulator reaches the interval, and each
 * flush drains at most {@code batchSize} events.
 *
 * Not thread-safe; the bus guards it with its own lock.
 */
class DispatchThrottle {

    private final long intervalMs;
    private final int batchSize;
    private long accumulatedMs = 0;

    DispatchThrottle(long intervalMs, int batchSize) {
        this.intervalMs = intervalMs;
        this.batchSize = batchSize;
    }

    /**
     * Add elapsed time and report whether a flush is due. When it is, the
     * accumulator is reset.
     */
    boolean advance(long deltaMs) {
        if (deltaMs > 0) {
            accumulatedMs += deltaMs;
        }
        if (accumulatedMs < intervalMs) {
            return false;
        }
        accumulatedMs = 0;
        return true;
    }

    long getAccumulatedMs() { return accumulatedMs; }

    long getIntervalMs() { return intervalMs; }

    int getBatchSize() { return batchSize; }

    void reset() {
        accumulatedMs = 0;
    }
}
