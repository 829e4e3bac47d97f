package com.frontline.core.domain.influence;

/**
 * External action submission as received from combat/mission collaborators or
 * player sessions.
 */
public record ActionRequest(
        int territoryId,
        int factionId,
        ActionKind kind,
        double magnitude,
        String actorId,
        long timestampMs
) {}
