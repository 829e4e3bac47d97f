package com.frontline.core.domain.influence;

/**
 * One (territory, faction) influence row.
 *
 * lastRefreshedMs only moves on actions, never on decay, so the decay grace
 * window can be evaluated from it.
 */
public record InfluenceRecord(
        int territoryId,
        int factionId,
        double value,
        long lastRefreshedMs,
        long lastUpdatedMs
) {
    public InfluenceRecord withValue(double newValue, long nowMs, boolean refresh) {
        return new InfluenceRecord(territoryId, factionId, newValue, refresh ? nowMs : lastRefreshedMs, nowMs);
    }
}
