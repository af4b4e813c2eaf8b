package com.example.skirmish.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Simple scheduler for periodic "tick" tasks.
 * Subsystems register Runnables by name at their own intervals (ms).
 */
public class TickService {

    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public TickService() {
        // single-threaded scheduler to serialize tick operations
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "skirmish-tick");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run {@code task} every {@code periodMs}. A task that throws is logged and
     * keeps its schedule.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("[TickService] Task {} failed: {}", name, e.getMessage(), e);
            }
        };
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(guarded, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(name, f);
        if (previous != null) {
            previous.cancel(false);
        }
        return f;
    }

    public boolean cancel(String name) {
        ScheduledFuture<?> f = tasks.remove(name);
        if (f == null) return false;
        return f.cancel(false);
    }

    public int getTaskCount() {
        return tasks.size();
    }

    public void shutdown() {
        for (ScheduledFuture<?> f : tasks.values()) {
            f.cancel(false);
        }
        tasks.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
