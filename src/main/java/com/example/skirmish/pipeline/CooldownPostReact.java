package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;
import com.example.skirmish.util.CooldownManager;

import java.util.Map;

/**
 * Post-react stage that puts the executed action kind on cooldown for the
 * request's source. Kinds without a configured duration get no cooldown.
 */
public class CooldownPostReact<S> implements PostReactStage<S> {

    private final CooldownManager cooldowns;
    private final Map<String, Long> durationsMs;

    public CooldownPostReact(CooldownManager cooldowns, Map<String, Long> durationsMs) {
        this.cooldowns = cooldowns;
        this.durationsMs = durationsMs == null ? Map.of() : Map.copyOf(durationsMs);
    }

    @Override
    public void postReact(ActionRequest request, S state) {
        Long duration = durationsMs.get(request.getActionKind());
        if (duration != null && duration > 0) {
            cooldowns.setCooldown(request.getSource(), request.getActionKind(), duration);
        }
    }

    public long getDurationMs(String actionKind) {
        return durationsMs.getOrDefault(actionKind, 0L);
    }
}
