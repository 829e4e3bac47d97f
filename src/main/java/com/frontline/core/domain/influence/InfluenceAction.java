package com.frontline.core.domain.influence;

/**
 * A single resolved call into the influence engine: the raw delta is already
 * faction-modified and is applied to {@code factionId}'s influence.
 *
 * {@code actingFactionId} is the faction that issued the action. It differs from
 * {@code factionId} only for actions aimed at a rival's record. Such writes, and
 * sabotage in general, do not refresh the record's decay grace window.
 */
public record InfluenceAction(
        int territoryId,
        int factionId,
        double rawDelta,
        EventCause cause,
        String actorId,
        String sessionId,
        int actingFactionId
) {
    public InfluenceAction(int territoryId, int factionId, double rawDelta, EventCause cause, String actorId, String sessionId) {
        this(territoryId, factionId, rawDelta, cause, actorId, sessionId, factionId);
    }

    public static InfluenceAction of(int territoryId, int factionId, double rawDelta, EventCause cause, String actorId) {
        return new InfluenceAction(territoryId, factionId, rawDelta, cause, actorId, null);
    }

    /** Whether this write counts as the holder's own activity. */
    public boolean refreshesHolder() {
        return actingFactionId == factionId && cause != null && cause.refreshesHolder();
    }
}
