package com.example.skirmish.pipeline;

import com.example.skirmish.action.ActionRequest;
import com.example.skirmish.event.CombatEventBus;
import com.example.skirmish.event.CombatEventType;
import com.example.skirmish.event.EventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execute stage for chain actions. The request context must be a
 * {@link ChainDefinition}; anything else is logged and reported and the
 * request has no effect.
 */
public class ChainActionExecute<S> implements ExecuteStage<S> {

    private static final Logger logger = LoggerFactory.getLogger(ChainActionExecute.class);

    private final ChainExecutor chainExecutor;
    private final CombatEventBus eventBus;
    private final ErrorReporter errorReporter;

    public ChainActionExecute(ChainExecutor chainExecutor, CombatEventBus eventBus, ErrorReporter errorReporter) {
        this.chainExecutor = chainExecutor;
        this.eventBus = eventBus;
        this.errorReporter = errorReporter;
    }

    @Override
    public void execute(ActionRequest request, S state) {
        ChainDefinition definition = request.getContext(ChainDefinition.class);
        if (definition == null) {
            Object context = request.getContext();
            String found = context == null ? "no context" : context.getClass().getSimpleName();
            logger.error("[ChainActionExecute] {} expected a ChainDefinition but got {}", request, found);
            errorReporter.report(ErrorReporter.CONTEXT_MISMATCH, request.getSource(),
                "expected ChainDefinition, got " + found, request);
            return;
        }

        if (request.isCancelled()) {
            logger.debug("[ChainActionExecute] Skipping cancelled {}", request);
            return;
        }

        chainExecutor.startChain(definition, request.getSource());

        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("actionKind", request.getActionKind());
        attrs.put("chainId", definition.getChainId());
        attrs.put("steps", String.valueOf(definition.getSteps().size()));
        eventBus.raise(CombatEventType.ACTION_STARTED, request.getSource(), null, EventPayload.attributes(attrs));
    }
}
