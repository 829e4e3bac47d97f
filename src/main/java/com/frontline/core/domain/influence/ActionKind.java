package com.frontline.core.domain.influence;

import java.util.Locale;

/**
 * Actions accepted from collaborators and player sessions.
 * Sabotage is the only kind that lowers a rival instead of raising the actor.
 */
public enum ActionKind {
    CAPTURE(1.0, false, EventCause.CAPTURE),
    DEFEND(0.75, false, EventCause.DEFEND),
    REINFORCE(0.5, false, EventCause.REINFORCE),
    SABOTAGE(1.0, true, EventCause.SABOTAGE);

    private final double weight;
    private final boolean targetsRival;
    private final EventCause cause;

    ActionKind(double weight, boolean targetsRival, EventCause cause) {
        this.weight = weight;
        this.targetsRival = targetsRival;
        this.cause = cause;
    }

    public double weight() {
        return weight;
    }

    public boolean targetsRival() {
        return targetsRival;
    }

    public EventCause cause() {
        return cause;
    }

    public static ActionKind parse(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        if (v.isBlank()) return null;
        try {
            return ActionKind.valueOf(v);
        } catch (IllegalArgumentException ignored) {
            return null;
        }
    }
}
