package com.example.skirmish.event;

/**
 * Kinds of consequence announced on the combat event bus.
 */
public enum CombatEventType {

    /** An action passed its checks and began executing */
    ACTION_STARTED("Action Started"),

    /** An action finished executing */
    ACTION_COMPLETED("Action Completed"),

    DAMAGE_DEALT("Damage Dealt"),

    EFFECT_APPLIED("Effect Applied"),

    EFFECT_REMOVED("Effect Removed"),

    /** A combatant's status changed (stance, death, stun...) */
    STATUS_CHANGED("Status Changed"),

    /** Game-specific events that have no dedicated kind */
    CUSTOM("Custom"),

    /** An action was rejected or failed while resolving */
    ACTION_ERROR("Action Error");

    private final String displayName;

    CombatEventType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
