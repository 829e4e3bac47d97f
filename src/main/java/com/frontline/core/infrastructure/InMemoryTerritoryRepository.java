package com.frontline.core.infrastructure;

import com.frontline.core.domain.factions.FactionDefinition;
import com.frontline.core.domain.influence.InfluenceRecord;
import com.frontline.core.domain.influence.TerritorialEvent;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.WorldDefinition;
import com.frontline.core.ports.ITerritoryRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Storage for offline runs (db.enabled=false) and tests. Same contract as the
 * MariaDB adapter, kept in process memory.
 */
public class InMemoryTerritoryRepository implements ITerritoryRepository {

    private final List<Territory> territories = new ArrayList<>();
    private final List<FactionDefinition> factions = new ArrayList<>();
    private final Map<String, InfluenceRecord> influence = new TreeMap<>();
    private final TreeMap<Long, TerritorialEvent> events = new TreeMap<>();

    @Override
    public synchronized List<Territory> loadTerritories() {
        return new ArrayList<>(territories);
    }

    @Override
    public synchronized List<FactionDefinition> loadFactions() {
        return new ArrayList<>(factions);
    }

    @Override
    public synchronized void replaceWorld(WorldDefinition world) {
        territories.clear();
        territories.addAll(world.territories());
        factions.clear();
        factions.addAll(world.factions());
        influence.clear();
    }

    @Override
    public synchronized List<InfluenceRecord> loadInfluence() {
        return new ArrayList<>(influence.values());
    }

    @Override
    public synchronized void saveInfluence(Collection<InfluenceRecord> records) {
        for (InfluenceRecord r : records) {
            influence.put(r.territoryId() + ":" + r.factionId(), r);
        }
    }

    @Override
    public synchronized void appendEvents(List<TerritorialEvent> batch) {
        for (TerritorialEvent e : batch) {
            events.putIfAbsent(e.id(), e);
        }
    }

    @Override
    public synchronized List<TerritorialEvent> loadEvents(long afterId, int limit) {
        List<TerritorialEvent> out = new ArrayList<>();
        for (TerritorialEvent e : events.tailMap(afterId, false).values()) {
            out.add(e);
            if (out.size() >= limit) break;
        }
        return out;
    }

    @Override
    public synchronized long maxEventId() {
        return events.isEmpty() ? 0L : events.lastKey();
    }
}
