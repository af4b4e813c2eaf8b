package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;

/**
 * Second pipeline stage. Performs the world-state changes for a request and
 * announces them on the event bus.
 */
@FunctionalInterface
public interface ExecuteStage<S> {
    void execute(ActionRequest request, S state);
}
