package com.example.skirmish.action;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One requested action (player input, AI decision or scripted event).
 * Everything is fixed at construction except the cancellation flag, which
 * moves from false to true at most once and may be flipped from any thread.
 *
 * Cancellation is advisory: the pipeline does not stop a running request on
 * its own. Stages doing irreversible work check {@link #isCancelled()} before
 * committing.
 */
public class ActionRequest {

    private final UUID requestId;
    private final String actionKind;
    private final String source;
    private final Instant createdAt;
    private final Object context;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ActionRequest(String actionKind, String source, Instant createdAt, Object context) {
        if (actionKind == null || actionKind.isBlank()) {
            throw new IllegalArgumentException("actionKind is required");
        }
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        this.requestId = UUID.randomUUID();
        this.actionKind = actionKind;
        this.source = source;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.context = context;
    }

    public ActionRequest(String actionKind, String source, Instant createdAt) {
        this(actionKind, source, createdAt, null);
    }

    public UUID getRequestId() { return requestId; }
    public String getActionKind() { return actionKind; }
    public String getSource() { return source; }
    public Instant getCreatedAt() { return createdAt; }
    public Object getContext() { return context; }

    /**
     * Typed view of the context payload.
     * @return the context as {@code type}, or null if absent or of another type
     */
    public <T> T getContext(Class<T> type) {
        if (type.isInstance(context)) {
            return type.cast(context);
        }
        return null;
    }

    /**
     * Cancel this request. Safe to call any number of times from any thread.
     * @return true only for the call that actually cancelled the request
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return String.format("ActionRequest[%s %s from %s%s]",
            actionKind, requestId, source, isCancelled() ? ", cancelled" : "");
    }
}
