package com.example.skirmish.action;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Ranks action requests by kind and picks a winner among requests offered
 * during the same tick.
 *
 * Ties go to the request that appears first: a later candidate only takes over
 * when its priority is strictly greater.
 */
public class PriorityResolver {

    public static final int SPECIAL_ABILITY_PRIORITY = 100;
    public static final int CHAIN_ACTION_PRIORITY = 75;
    public static final int BASIC_ATTACK_PRIORITY = 50;
    public static final int CONTEXTUAL_ACTION_PRIORITY = 10;
    public static final int UNRECOGNIZED_PRIORITY = 0;

    private static final Map<String, Integer> DEFAULT_TABLE;

    static {
        Map<String, Integer> table = new HashMap<>();
        table.put(ActionKinds.SPECIAL_ABILITY, SPECIAL_ABILITY_PRIORITY);
        table.put(ActionKinds.CHAIN_ACTION, CHAIN_ACTION_PRIORITY);
        table.put(ActionKinds.BASIC_ATTACK, BASIC_ATTACK_PRIORITY);
        table.put(ActionKinds.CONTEXTUAL_ACTION, CONTEXTUAL_ACTION_PRIORITY);
        DEFAULT_TABLE = Collections.unmodifiableMap(table);
    }

    private final Map<String, Integer> priorities;

    public PriorityResolver() {
        this(DEFAULT_TABLE);
    }

    /**
     * Create a resolver with a custom table. Kinds missing from the table rank
     * as {@link #UNRECOGNIZED_PRIORITY}.
     */
    public PriorityResolver(Map<String, Integer> priorities) {
        this.priorities = Collections.unmodifiableMap(new HashMap<>(priorities));
    }

    public static Map<String, Integer> defaultTable() {
        return DEFAULT_TABLE;
    }

    /**
     * Return a resolver whose table also ranks {@code kind} at {@code priority}.
     */
    public PriorityResolver withPriority(String kind, int priority) {
        Map<String, Integer> extended = new HashMap<>(priorities);
        extended.put(kind, priority);
        return new PriorityResolver(extended);
    }

    /**
     * Priority of a request. The default implementation looks only at the action
     * kind; {@code state} is there for subclasses with contextual rules.
     */
    public int priorityOf(ActionRequest request, Object state) {
        if (request == null) return UNRECOGNIZED_PRIORITY;
        return priorities.getOrDefault(request.getActionKind(), UNRECOGNIZED_PRIORITY);
    }

    /**
     * Pick the highest-priority request. Null entries are skipped.
     * @return the winner, or null if there were no candidates
     */
    public ActionRequest resolve(Collection<ActionRequest> requests, Object state) {
        if (requests == null) return null;

        ActionRequest winner = null;
        int best = Integer.MIN_VALUE;
        for (ActionRequest candidate : requests) {
            if (candidate == null) continue;
            int priority = priorityOf(candidate, state);
            if (winner == null || priority > best) {
                winner = candidate;
                best = priority;
            }
        }
        return winner;
    }
}
