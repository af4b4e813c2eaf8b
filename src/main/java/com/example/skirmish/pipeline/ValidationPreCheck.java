package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;
import com.example.skirmish.util.CooldownManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default pre-check. A request passes when it has not been cancelled, its
 * source is not on cooldown for the action kind, and the validation gate
 * accepts it.
 */
public class ValidationPreCheck<S> implements PreCheckStage<S> {

    private static final Logger logger = LoggerFactory.getLogger(ValidationPreCheck.class);

    private final ValidationGate<S> gate;
    private final CooldownManager cooldowns;

    public ValidationPreCheck(ValidationGate<S> gate, CooldownManager cooldowns) {
        this.gate = gate != null ? gate : ValidationGate.allowAll();
        this.cooldowns = cooldowns;
    }

    public ValidationPreCheck(ValidationGate<S> gate) {
        this(gate, null);
    }

    @Override
    public boolean preCheck(ActionRequest request, S state) {
        if (request.isCancelled()) {
            logger.debug("[ValidationPreCheck] {} was cancelled before running", request);
            return false;
        }
        if (cooldowns != null && cooldowns.isOnCooldown(request.getSource(), request.getActionKind())) {
            logger.debug("[ValidationPreCheck] {} on cooldown for {} more ms", request,
                cooldowns.getRemainingMs(request.getSource(), request.getActionKind()));
            return false;
        }
        return gate.isValid(request, state);
    }
}
