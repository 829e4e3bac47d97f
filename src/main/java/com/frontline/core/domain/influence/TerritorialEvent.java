package com.frontline.core.domain.influence;

/**
 * Append-only audit record of one applied influence change.
 *
 * resultingValue is the stored value after the change; replaying events in id
 * order from an empty store reproduces the exact influence state.
 */
public record TerritorialEvent(
        long id,
        long timestampMs,
        int territoryId,
        int factionId,
        String actorId,
        String sessionId,
        EventCause cause,
        double requestedDelta,
        double appliedDelta,
        double resultingValue,
        EventPriority priority,
        boolean controlChanged,
        int cascadeWave
) {}
