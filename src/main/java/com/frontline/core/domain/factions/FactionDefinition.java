package com.frontline.core.domain.factions;

/**
 * Read-only faction roster entry. influenceModifier scales every action the faction submits.
 */
public record FactionDefinition(
        int id,
        String code,
        String displayName,
        BehaviorProfile profile,
        double influenceModifier
) {
    public FactionDefinition {
        code = (code != null && !code.isBlank()) ? code.trim() : ("faction_" + id);
        displayName = (displayName != null && !displayName.isBlank()) ? displayName : code;
        profile = (profile != null) ? profile : BehaviorProfile.balanced();
        if (Double.isNaN(influenceModifier) || Double.isInfinite(influenceModifier) || influenceModifier <= 0.0) {
            influenceModifier = 1.0;
        }
    }
}
