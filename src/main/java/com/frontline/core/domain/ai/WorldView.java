package com.frontline.core.domain.ai;

import com.frontline.core.domain.influence.InfluenceSnapshot;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.TerritoryGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Frozen picture of the world handed to a faction tick.
 * Built from one coherent store snapshot, so scoring never observes a half-applied cascade.
 */
public record WorldView(
        TerritoryGraph graph,
        Map<Integer, InfluenceSnapshot> snapshots,
        double controlThreshold,
        double contestThreshold
) {
    public WorldView {
        Objects.requireNonNull(graph, "graph");
        snapshots = Map.copyOf(snapshots != null ? snapshots : Map.of());
    }

    public InfluenceSnapshot snapshot(int territoryId) {
        InfluenceSnapshot s = snapshots.get(territoryId);
        return (s != null) ? s : InfluenceSnapshot.empty(territoryId);
    }

    public Integer controllerOf(int territoryId) {
        return snapshot(territoryId).controllerId();
    }

    public List<Integer> controlledBy(int factionId) {
        List<Integer> out = new ArrayList<>();
        for (Territory t : graph.all()) {
            if (Objects.equals(controllerOf(t.id()), factionId)) out.add(t.id());
        }
        out.sort(Integer::compareTo);
        return out;
    }

    /** Territories where the faction holds any influence, in id order. */
    public Map<Integer, Double> presenceOf(int factionId) {
        Map<Integer, Double> out = new TreeMap<>();
        for (Territory t : graph.all()) {
            double v = snapshot(t.id()).influenceOf(factionId);
            if (v > 0.0) out.put(t.id(), v);
        }
        return out;
    }
}
