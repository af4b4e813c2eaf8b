package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;
import com.example.skirmish.action.PriorityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects action requests offered from any thread (input, AI, scripts) and
 * resolves them once per simulation tick.
 *
 * On {@link #drain(Object)} each source gets at most one action: cancelled
 * requests are dropped, the {@link PriorityResolver} picks the winner among the
 * rest, the losers are cancelled, and the winner is run through the pipeline.
 * Sources are handled in the order they first offered during the tick.
 */
public class ActionIntake<S> {

    private static final Logger logger = LoggerFactory.getLogger(ActionIntake.class);

    private final PriorityResolver resolver;
    private final ActionPipeline<S> pipeline;

    private final Object lock = new Object();
    private Map<String, List<ActionRequest>> pending = new LinkedHashMap<>();

    private final AtomicLong totalOffered = new AtomicLong();
    private final AtomicLong totalResolved = new AtomicLong();

    public ActionIntake(PriorityResolver resolver, ActionPipeline<S> pipeline) {
        this.resolver = resolver;
        this.pipeline = pipeline;
    }

    /**
     * Offer a request for the next tick. Thread-safe.
     */
    public void offer(ActionRequest request) {
        if (request == null) return;
        synchronized (lock) {
            pending.computeIfAbsent(request.getSource(), k -> new ArrayList<>()).add(request);
        }
        totalOffered.incrementAndGet();
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.values().stream().mapToInt(List::size).sum();
        }
    }

    /**
     * Resolve and run everything offered since the last drain. Call from the
     * simulation tick only.
     * @return the requests that ran to completion, in processing order
     */
    public List<ActionRequest> drain(S state) {
        Map<String, List<ActionRequest>> batch;
        synchronized (lock) {
            if (pending.isEmpty()) return List.of();
            batch = pending;
            pending = new LinkedHashMap<>();
        }

        List<ActionRequest> completed = new ArrayList<>();
        for (Map.Entry<String, List<ActionRequest>> entry : batch.entrySet()) {
            List<ActionRequest> live = new ArrayList<>();
            for (ActionRequest r : entry.getValue()) {
                if (!r.isCancelled()) live.add(r);
            }

            ActionRequest winner = resolver.resolve(live, state);
            if (winner == null) continue;
            for (ActionRequest r : live) {
                if (r != winner) r.cancel();
            }
            totalResolved.incrementAndGet();

            try {
                if (pipeline.run(winner, state)) {
                    completed.add(winner);
                }
            } catch (RuntimeException | Error e) {
                // already reported by the pipeline; other sources still get their turn
                logger.error("[ActionIntake] {} from {} aborted: {}", winner.getActionKind(), entry.getKey(), e.toString(), e);
            }
        }
        return completed;
    }

    public long getTotalOffered() { return totalOffered.get(); }
    public long getTotalResolved() { return totalResolved.get(); }
}
