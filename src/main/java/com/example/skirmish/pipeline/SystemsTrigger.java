package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;

/**
 * Fans an executed action out to the rest of the game (animation, audio and
 * so on). What happens behind it is not the pipeline's business.
 */
@FunctionalInterface
public interface SystemsTrigger<S> {
    void trigger(ActionRequest request, S state);

    static <S> SystemsTrigger<S> none() {
        return (request, state) -> {};
    }
}
