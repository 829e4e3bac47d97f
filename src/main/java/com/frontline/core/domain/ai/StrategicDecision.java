package com.frontline.core.domain.ai;

import com.frontline.core.domain.influence.InfluenceAction;

public record StrategicDecision(
        int factionId,
        StrategicAction action,
        int territoryId,
        Integer targetControllerId,
        int strategicValue,
        double score
) {
    /**
     * Translates the decision into the single engine call a faction tick is allowed to make.
     * The faction's influence modifier is applied here, the same as for player actions.
     */
    public InfluenceAction toInfluenceAction(double baseMagnitude, double influenceModifier) {
        double delta = baseMagnitude * action.magnitudeFactor() * influenceModifier;
        return new InfluenceAction(territoryId, factionId, delta, action.cause(), "faction:" + factionId, null);
    }
}
