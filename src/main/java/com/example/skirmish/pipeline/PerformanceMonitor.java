package com.example.skirmish.pipeline;

/**
 * Receives timing spans around each pipeline run.
 */
public interface PerformanceMonitor {

    void startTiming(String key);

    /**
     * Close the span opened under {@code key}.
     * @param actionKind used to aggregate spans per kind
     */
    void stopTiming(String key, String actionKind);
}
