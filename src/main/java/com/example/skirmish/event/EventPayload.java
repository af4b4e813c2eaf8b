package com.example.skirmish.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload carried by a {@link CombatEvent}. The set of payload shapes is closed
 * so every event can be written to the wire and read back on another process;
 * game code that needs something ad hoc uses {@link Attributes}.
 */
public interface EventPayload {

    /** Wire tag for each payload shape. */
    enum Type { NONE, DAMAGE, EFFECT, STATUS, MESSAGE, ATTRIBUTES }

    Type type();

    static EventPayload none() {
        return None.INSTANCE;
    }

    static EventPayload damage(int amount, String damageType, boolean critical) {
        return new Damage(amount, damageType, critical);
    }

    static EventPayload effect(String effectId, long durationMs) {
        return new Effect(effectId, durationMs);
    }

    static EventPayload status(String status) {
        return new Status(status);
    }

    static EventPayload message(String text) {
        return new Message(text);
    }

    static EventPayload attributes(Map<String, String> values) {
        return new Attributes(values);
    }

    final class None implements EventPayload {
        static final None INSTANCE = new None();

        private None() {}

        @Override
        public Type type() { return Type.NONE; }

        @Override
        public String toString() { return "None"; }
    }

    record Damage(int amount, String damageType, boolean critical) implements EventPayload {
        @Override
        public Type type() { return Type.DAMAGE; }
    }

    /**
     * @param durationMs 0 for effects without a fixed duration
     */
    record Effect(String effectId, long durationMs) implements EventPayload {
        public Effect {
            if (effectId == null) throw new IllegalArgumentException("effectId is required");
        }

        @Override
        public Type type() { return Type.EFFECT; }
    }

    record Status(String status) implements EventPayload {
        public Status {
            if (status == null) throw new IllegalArgumentException("status is required");
        }

        @Override
        public Type type() { return Type.STATUS; }
    }

    record Message(String text) implements EventPayload {
        public Message {
            if (text == null) throw new IllegalArgumentException("text is required");
        }

        @Override
        public Type type() { return Type.MESSAGE; }
    }

    record Attributes(Map<String, String> values) implements EventPayload {
        public Attributes {
            values = values == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        @Override
        public Type type() { return Type.ATTRIBUTES; }
    }
}
