package com.frontline.core.managers;

import com.frontline.core.domain.influence.TerritorialEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rebuilds influence state from an event log.
 *
 * Each event carries the value stored after it was applied, so replay writes that
 * value instead of re-adding deltas: the result is exact regardless of clamping or
 * floating point accumulation. Nothing is published and no cascade runs.
 */
public final class EventReplayer {

    private final TerritoryStore store;

    public EventReplayer(TerritoryStore store) {
        this.store = store;
    }

    /**
     * @return number of events applied; events for territories or factions not in the
     *         loaded world are skipped
     */
    public int replay(List<TerritorialEvent> events) {
        List<TerritorialEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparingLong(TerritorialEvent::id));

        int applied = 0;
        int skipped = 0;
        for (TerritorialEvent e : ordered) {
            if (store.getTerritory(e.territoryId()) == null || store.getFaction(e.factionId()) == null) {
                skipped++;
                continue;
            }
            store.write(e.territoryId(), e.factionId(), e.resultingValue(), e.cause().refreshesHolder());
            applied++;
        }

        if (skipped > 0) {
            System.err.println("[REPLAY] Skipped " + skipped + " events for unknown territories/factions.");
        }
        return applied;
    }
}
