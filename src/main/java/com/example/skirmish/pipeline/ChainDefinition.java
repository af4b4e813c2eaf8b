package com.example.skirmish.pipeline;

import java.util.Collections;
import java.util.List;

/**
 * Context payload of a chain action: the chain to start and its steps in order.
 */
public class ChainDefinition {

    private final String chainId;
    private final List<String> steps;
    /** How long the owner has to continue the chain between steps; 0 for no limit */
    private final long stepWindowMs;

    public ChainDefinition(String chainId, List<String> steps, long stepWindowMs) {
        if (chainId == null || chainId.isBlank()) {
            throw new IllegalArgumentException("chainId is required");
        }
        this.chainId = chainId;
        this.steps = steps == null ? Collections.emptyList() : List.copyOf(steps);
        this.stepWindowMs = Math.max(0, stepWindowMs);
    }

    public ChainDefinition(String chainId, List<String> steps) {
        this(chainId, steps, 0);
    }

    public String getChainId() { return chainId; }
    public List<String> getSteps() { return steps; }
    public long getStepWindowMs() { return stepWindowMs; }

    @Override
    public String toString() {
        return "ChainDefinition[" + chainId + ", steps=" + steps + "]";
    }
}
