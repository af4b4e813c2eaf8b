package com.example.skirmish.event;

/**
 * Receives events from the {@link CombatEventBus}. Called synchronously on the
 * dispatching thread while the bus lock is held, so keep it short and do not
 * block.
 */
@FunctionalInterface
public interface CombatEventListener {
    void onEvent(CombatEvent event);
}
