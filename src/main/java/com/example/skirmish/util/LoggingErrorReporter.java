package com.example.skirmish.util;

import com.example.skirmish.action.ActionRequest;
import com.example.skirmish.event.CombatEventBus;
import com.example.skirmish.event.CombatEventType;
import com.example.skirmish.event.EventPayload;
import com.example.skirmish.pipeline.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Error reporter that logs each diagnostic and, when bound to an event bus,
 * queues an {@link CombatEventType#ACTION_ERROR} event so UI and analytics
 * subscribers can see rejected actions.
 */
public class LoggingErrorReporter implements ErrorReporter {

    private static final Logger logger = LoggerFactory.getLogger(LoggingErrorReporter.class);

    private final CombatEventBus eventBus;
    private final AtomicLong reportCount = new AtomicLong();

    public LoggingErrorReporter(CombatEventBus eventBus) {
        this.eventBus = eventBus;
    }

    public LoggingErrorReporter() {
        this(null);
    }

    @Override
    public void report(String kind, String actor, String message, ActionRequest request) {
        reportCount.incrementAndGet();
        logger.warn("[{}] {}: {} ({})", kind, actor, message, request);

        if (eventBus == null || eventBus.isClosed()) return;

        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("kind", kind);
        attrs.put("message", message);
        if (request != null) {
            attrs.put("actionKind", request.getActionKind());
            attrs.put("requestId", request.getRequestId().toString());
        }
        try {
            eventBus.raise(CombatEventType.ACTION_ERROR, actor, null, EventPayload.attributes(attrs));
        } catch (IllegalStateException e) {
            // bus closed between the check and the raise; the log line above is all we can do
            logger.debug("[LoggingErrorReporter] Event bus closed, {} not published", kind);
        }
    }

    public long getReportCount() {
        return reportCount.get();
    }
}
