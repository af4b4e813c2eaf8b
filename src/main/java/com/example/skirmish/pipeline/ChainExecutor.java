package com.example.skirmish.pipeline;

/**
 * Runs multi-step chain actions (combos, scripted sequences).
 */
@FunctionalInterface
public interface ChainExecutor {
    void startChain(ChainDefinition definition, String owner);
}
