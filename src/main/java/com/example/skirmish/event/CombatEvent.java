package com.example.skirmish.event;

import java.time.Instant;

/**
 * Immutable record of something that happened while resolving an action.
 * Created once per raise and never changed afterwards.
 *
 * @param target may be null for events without a target
 */
public record CombatEvent(
    CombatEventType type,
    String actor,
    String target,
    EventPayload payload,
    Instant timestamp
) {
    public CombatEvent {
        if (type == null) throw new IllegalArgumentException("type is required");
        if (timestamp == null) throw new IllegalArgumentException("timestamp is required");
        if (payload == null) payload = EventPayload.none();
    }

    @Override
    public String toString() {
        return String.format("CombatEvent[%s %s -> %s, %s @ %s]",
            type, actor != null ? actor : "?", target != null ? target : "-", payload, timestamp);
    }
}
