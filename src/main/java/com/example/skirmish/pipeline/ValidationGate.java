package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;

/**
 * Game-specific validity rule consulted by {@link ValidationPreCheck}
 * (target in range, enough resources, not stunned...).
 */
@FunctionalInterface
public interface ValidationGate<S> {
    boolean isValid(ActionRequest request, S state);

    static <S> ValidationGate<S> allowAll() {
        return (request, state) -> true;
    }
}
