package com.frontline.core.managers;

import com.frontline.core.domain.factions.FactionDefinition;
import com.frontline.core.domain.influence.InfluenceSnapshot;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.domain.territory.Territory;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Monitoring view: per-territory control, per-faction holdings, engine counters.
 */
public final class TerritorialIntrospection {

    private final TerritoryStore store;
    private final DominanceTracker dominance;
    private final EngineTelemetry telemetry;
    private final Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    public TerritorialIntrospection(TerritoryStore store, DominanceTracker dominance, EngineTelemetry telemetry) {
        this.store = store;
        this.dominance = dominance;
        this.telemetry = telemetry;
    }

    public HealthReport report() {
        Map<Integer, InfluenceSnapshot> all = store.snapshotAll();

        List<TerritoryStatus> territories = new ArrayList<>();
        Map<Integer, Integer> controlledCounts = new TreeMap<>();
        for (FactionDefinition f : store.factions()) controlledCounts.put(f.id(), 0);

        for (Map.Entry<Integer, InfluenceSnapshot> e : all.entrySet()) {
            Territory t = store.getTerritory(e.getKey());
            InfluenceSnapshot s = e.getValue();
            territories.add(new TerritoryStatus(
                    e.getKey(),
                    (t != null) ? t.name() : null,
                    s.controllerId(),
                    s.contested()
            ));
            if (s.controllerId() != null) controlledCounts.merge(s.controllerId(), 1, Integer::sum);
        }

        return new HealthReport(
                territories,
                controlledCounts,
                (dominance != null) ? dominance.allDominance() : Map.of(),
                (telemetry != null) ? telemetry.snapshot() : Map.of(),
                store.dirtyCount()
        );
    }

    public String reportJson() {
        HealthReport r = report();
        JsonObject root = new JsonObject();

        JsonArray territories = new JsonArray();
        for (TerritoryStatus t : r.territories()) {
            JsonObject o = new JsonObject();
            o.addProperty("territoryId", t.territoryId());
            o.addProperty("name", t.name());
            o.addProperty("controllerId", t.controllerId());
            o.addProperty("contested", t.contested());
            territories.add(o);
        }
        root.add("territories", territories);

        JsonObject counts = new JsonObject();
        r.controlledCounts().forEach((k, v) -> counts.addProperty(String.valueOf(k), v));
        root.add("controlledCounts", counts);

        JsonObject dom = new JsonObject();
        r.dominance().forEach((k, v) -> dom.addProperty(String.valueOf(k), v));
        root.add("dominance", dom);

        JsonObject counters = new JsonObject();
        r.counters().forEach(counters::addProperty);
        root.add("counters", counters);

        root.addProperty("dirtyRecords", r.dirtyRecords());
        return gson.toJson(root);
    }

    public record TerritoryStatus(int territoryId, String name, Integer controllerId, boolean contested) {}

    public record HealthReport(
            List<TerritoryStatus> territories,
            Map<Integer, Integer> controlledCounts,
            Map<Integer, Integer> dominance,
            Map<String, Long> counters,
            int dirtyRecords
    ) {
        public HealthReport {
            territories = List.copyOf(territories);
            controlledCounts = Map.copyOf(controlledCounts);
            dominance = Map.copyOf(dominance);
            counters = Map.copyOf(counters);
        }
    }
}
