package com.example.skirmish.action;

/**
 * Well-known action kinds. Action kinds are open strings, so new kinds can be
 * used without touching this class; these are the ones the default priority
 * table knows about.
 */
public final class ActionKinds {

    public static final String SPECIAL_ABILITY = "special_ability";
    public static final String CHAIN_ACTION = "chain_action";
    public static final String BASIC_ATTACK = "basic_attack";
    public static final String CONTEXTUAL_ACTION = "contextual_action";

    private ActionKinds() {}
}
