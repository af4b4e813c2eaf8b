package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;

/**
 * Last pipeline stage: cooldowns, follow-up scheduling.
 */
@FunctionalInterface
public interface PostReactStage<S> {
    void postReact(ActionRequest request, S state);

    static <S> PostReactStage<S> none() {
        return (request, state) -> {};
    }
}
