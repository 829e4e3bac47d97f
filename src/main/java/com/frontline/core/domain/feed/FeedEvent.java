package com.frontline.core.domain.feed;

import java.util.List;

/**
 * One notification on the territorial feed.
 *
 * For DOMINANCE the territory is the region and the controller ids are the
 * previous and new dominant factions. sequence is 0 until the feed assigns
 * the per-territory number on publish.
 */
public record FeedEvent(
        FeedEventKind kind,
        int territoryId,
        String territoryName,
        Integer previousControllerId,
        Integer newControllerId,
        int strategicValue,
        boolean contested,
        List<Integer> connectedTerritoryIds,
        long sequence,
        boolean lowPriority,
        long timestampMs
) {
    public FeedEvent {
        connectedTerritoryIds = List.copyOf(connectedTerritoryIds != null ? connectedTerritoryIds : List.of());
    }

    public FeedEvent withSequence(long seq) {
        return new FeedEvent(kind, territoryId, territoryName, previousControllerId, newControllerId,
                strategicValue, contested, connectedTerritoryIds, seq, lowPriority, timestampMs);
    }
}
