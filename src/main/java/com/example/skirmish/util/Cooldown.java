package com.example.skirmish.util;

/**
 * Cooldown entry for one action kind of one source.
 * Remaining time is kept in milliseconds and decremented by the simulation tick.
 */
public class Cooldown {
    private final String actionKind;
    private long remainingMs;

    public Cooldown(String actionKind, long remainingMs) {
        this.actionKind = actionKind;
        this.remainingMs = Math.max(0, remainingMs);
    }

    public String getActionKind() { return actionKind; }
    public synchronized long getRemainingMs() { return remainingMs; }

    /**
     * Decrement the remaining cooldown.
     * @param deltaMs time elapsed since last tick
     * @return true if the cooldown has expired
     */
    public synchronized boolean tick(long deltaMs) {
        remainingMs = Math.max(0, remainingMs - Math.max(0, deltaMs));
        return remainingMs <= 0;
    }

    public synchronized boolean isExpired() {
        return remainingMs <= 0;
    }
}
