package com.frontline.core.ports;

import com.frontline.core.domain.factions.FactionDefinition;
import com.frontline.core.domain.influence.InfluenceRecord;
import com.frontline.core.domain.influence.TerritorialEvent;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.WorldDefinition;

import java.util.Collection;
import java.util.List;

/**
 * Storage contract. Reads degrade to empty results when the store is unavailable;
 * writes throw {@link com.frontline.core.domain.errors.PersistenceException} so the
 * write-behind services can keep their data dirty and retry.
 */
public interface ITerritoryRepository {

    // --- WORLD ---
    List<Territory> loadTerritories();
    List<FactionDefinition> loadFactions();
    /** Replaces territories, links and factions. Stored influence rows are dropped with them. */
    void replaceWorld(WorldDefinition world);

    // --- INFLUENCE ---
    List<InfluenceRecord> loadInfluence();
    void saveInfluence(Collection<InfluenceRecord> records);

    // --- EVENTS ---
    void appendEvents(List<TerritorialEvent> events);
    List<TerritorialEvent> loadEvents(long afterId, int limit);
    long maxEventId();
}
