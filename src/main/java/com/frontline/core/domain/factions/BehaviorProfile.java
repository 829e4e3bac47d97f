package com.frontline.core.domain.factions;

/**
 * Read-only strategic parameters, all in [0,1].
 */
public record BehaviorProfile(
        double aggression,
        double riskTolerance,
        double expansionPriority,
        double resourceFocus,
        double diplomaticTendency
) {
    public static BehaviorProfile balanced() {
        return new BehaviorProfile(0.5, 0.5, 0.5, 0.5, 0.5);
    }

    public boolean isWithinBounds() {
        return inUnit(aggression)
                && inUnit(riskTolerance)
                && inUnit(expansionPriority)
                && inUnit(resourceFocus)
                && inUnit(diplomaticTendency);
    }

    private static boolean inUnit(double v) {
        return !Double.isNaN(v) && v >= 0.0 && v <= 1.0;
    }
}
