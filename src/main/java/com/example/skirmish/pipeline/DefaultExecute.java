package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;
import com.example.skirmish.event.CombatEventBus;
import com.example.skirmish.event.CombatEventType;
import com.example.skirmish.event.EventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default execute stage. Announces the action, hands it to the systems
 * trigger, then announces completion. Both announcements are queued for the
 * next dispatch tick.
 *
 * A request cancelled before this stage starts is skipped without effects.
 */
public class DefaultExecute<S> implements ExecuteStage<S> {

    private static final Logger logger = LoggerFactory.getLogger(DefaultExecute.class);

    private final CombatEventBus eventBus;
    private final SystemsTrigger<S> systemsTrigger;

    public DefaultExecute(CombatEventBus eventBus, SystemsTrigger<S> systemsTrigger) {
        this.eventBus = eventBus;
        this.systemsTrigger = systemsTrigger != null ? systemsTrigger : SystemsTrigger.none();
    }

    @Override
    public void execute(ActionRequest request, S state) {
        if (request.isCancelled()) {
            logger.debug("[DefaultExecute] Skipping cancelled {}", request);
            return;
        }

        EventPayload payload = EventPayload.message(request.getActionKind());
        eventBus.raise(CombatEventType.ACTION_STARTED, request.getSource(), null, payload);
        systemsTrigger.trigger(request, state);
        eventBus.raise(CombatEventType.ACTION_COMPLETED, request.getSource(), null, payload);
    }
}
