package com.example.skirmish.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks action cooldowns for every source (player, mob, script).
 *
 * Sources are identified by the same string used as the action request's
 * source. The simulation tick calls {@link #tick(long)}, which decrements all
 * cooldowns and drops expired ones.
 */
public class CooldownManager {

    // source -> action kind -> cooldown
    private final Map<String, Map<String, Cooldown>> sourceCooldowns = new ConcurrentHashMap<>();

    /**
     * Advance all cooldowns and remove the expired ones.
     */
    public void tick(long deltaMs) {
        if (deltaMs <= 0) return;

        for (Map.Entry<String, Map<String, Cooldown>> sourceEntry : sourceCooldowns.entrySet()) {
            Map<String, Cooldown> cooldowns = sourceEntry.getValue();
            cooldowns.entrySet().removeIf(entry -> entry.getValue().tick(deltaMs));

            // Clean up empty source maps
            if (cooldowns.isEmpty()) {
                sourceCooldowns.remove(sourceEntry.getKey(), cooldowns);
            }
        }
    }

    /**
     * Put an action kind on cooldown for a source. Replaces any existing cooldown.
     */
    public void setCooldown(String source, String actionKind, long durationMs) {
        if (source == null || actionKind == null || durationMs <= 0) return;

        Map<String, Cooldown> cooldowns = sourceCooldowns.computeIfAbsent(source, k -> new ConcurrentHashMap<>());
        cooldowns.put(actionKind, new Cooldown(actionKind, durationMs));
    }

    /**
     * @return true if the action kind is on cooldown for the source, false if ready
     */
    public boolean isOnCooldown(String source, String actionKind) {
        if (source == null || actionKind == null) return false;

        Map<String, Cooldown> cooldowns = sourceCooldowns.get(source);
        if (cooldowns == null) return false;

        Cooldown cd = cooldowns.get(actionKind);
        return cd != null && !cd.isExpired();
    }

    /**
     * @return remaining milliseconds, or 0 if not on cooldown
     */
    public long getRemainingMs(String source, String actionKind) {
        if (source == null || actionKind == null) return 0;

        Map<String, Cooldown> cooldowns = sourceCooldowns.get(source);
        if (cooldowns == null) return 0;

        Cooldown cd = cooldowns.get(actionKind);
        return cd != null ? cd.getRemainingMs() : 0;
    }

    public void clearCooldown(String source, String actionKind) {
        if (source == null || actionKind == null) return;

        Map<String, Cooldown> cooldowns = sourceCooldowns.get(source);
        if (cooldowns != null) {
            cooldowns.remove(actionKind);
        }
    }

    /**
     * Clear all cooldowns for a source (e.g., on death/despawn).
     */
    public void clearAll(String source) {
        if (source == null) return;
        sourceCooldowns.remove(source);
    }

    public int getTrackedSourceCount() {
        return sourceCooldowns.size();
    }

    public int getTotalActiveCooldowns() {
        return sourceCooldowns.values().stream()
                .mapToInt(Map::size)
                .sum();
    }
}
