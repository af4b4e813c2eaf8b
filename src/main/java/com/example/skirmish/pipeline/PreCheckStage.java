package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;

/**
 * First pipeline stage. Decides whether a request may run against the current
 * state; must not change that state.
 */
@FunctionalInterface
public interface PreCheckStage<S> {
    boolean preCheck(ActionRequest request, S state);
}
