package com.example.skirmish.event;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-capacity history of dispatched events. Once full, each append
 * overwrites the oldest entry.
 *
 * Not thread-safe; the bus guards it with its own lock.
 */
class EventLog {

    private final CombatEvent[] entries;
    /** Index where the next entry will be written */
    private int head = 0;
    private int size = 0;

    EventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.entries = new CombatEvent[capacity];
    }

    void append(CombatEvent event) {
        entries[head] = event;
        head = (head + 1) % entries.length;
        if (size < entries.length) {
            size++;
        }
    }

    /**
     * Up to {@code count} entries of the given type, newest first.
     */
    List<CombatEvent> recent(CombatEventType type, int count) {
        List<CombatEvent> out = new ArrayList<>();
        for (int i = 1; i <= size && out.size() < count; i++) {
            CombatEvent e = entries[Math.floorMod(head - i, entries.length)];
            if (e.type() == type) {
                out.add(e);
            }
        }
        return out;
    }

    int size() { return size; }

    int capacity() { return entries.length; }

    void clear() {
        Arrays.fill(entries, null);
        head = 0;
        size = 0;
    }
}
