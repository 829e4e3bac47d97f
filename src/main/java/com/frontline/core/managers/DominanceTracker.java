package com.frontline.core.managers;

import com.frontline.core.domain.feed.FeedEvent;
import com.frontline.core.domain.feed.FeedEventKind;
import com.frontline.core.domain.influence.InfluenceSnapshot;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.TerritoryGraph;
import com.frontline.core.domain.territory.TerritoryLevel;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.ports.IFeedPublisher;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Derived per-region dominance.
 *
 * A faction dominates a region when it controls more than half of the region's
 * immediate children, or controls at least {@code highValueCount} territories of
 * strategic value {@code >= highValueThreshold} inside the region (the region
 * itself included). If several factions qualify, the one holding more children
 * wins, then more high-value territories, then the lower id.
 *
 * Only transitions are published. The tracked state is derived and can be
 * rebuilt from the store at any time with {@link #rebaseline()}.
 */
public final class DominanceTracker {

    private final TerritoryStore store;
    private final TerritorialConfig config;
    private final IFeedPublisher publisher;
    private final Clock clock;

    private final Map<Integer, Integer> dominantByRegion = new HashMap<>();

    public DominanceTracker(TerritoryStore store, TerritorialConfig config, IFeedPublisher publisher, Clock clock) {
        this.store = store;
        this.config = config;
        this.publisher = publisher;
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    /**
     * Re-evaluates the regions containing {@code changedTerritoryIds} and publishes a
     * DOMINANCE event for each region whose dominant faction changed.
     */
    public synchronized List<FeedEvent> evaluate(Collection<Integer> changedTerritoryIds) {
        TerritoryGraph graph = store.graph();
        Set<Integer> regions = new TreeSet<>();
        for (Integer id : changedTerritoryIds) {
            Integer region = regionOf(graph, id);
            if (region != null) regions.add(region);
        }

        List<FeedEvent> out = new ArrayList<>();
        for (int regionId : regions) {
            Integer previous = dominantByRegion.get(regionId);
            Integer current = computeDominant(graph, regionId);
            if (Objects.equals(previous, current)) continue;

            if (current != null) dominantByRegion.put(regionId, current);
            else dominantByRegion.remove(regionId);

            Territory region = graph.get(regionId);
            FeedEvent event = new FeedEvent(
                    FeedEventKind.DOMINANCE,
                    regionId,
                    region.name(),
                    previous,
                    current,
                    region.strategicValue(),
                    store.isContested(regionId),
                    graph.children(regionId),
                    0L,
                    false,
                    clock.millis()
            );
            out.add(publisher != null ? publisher.publish(event) : event);
        }
        return out;
    }

    /** Recomputes every region silently, e.g. after a world load. */
    public synchronized void rebaseline() {
        dominantByRegion.clear();
        TerritoryGraph graph = store.graph();
        for (Territory t : graph.all()) {
            if (t.level() != TerritoryLevel.REGION) continue;
            Integer d = computeDominant(graph, t.id());
            if (d != null) dominantByRegion.put(t.id(), d);
        }
    }

    public synchronized Integer dominantIn(int regionId) {
        return dominantByRegion.get(regionId);
    }

    public synchronized Map<Integer, Integer> allDominance() {
        return new TreeMap<>(dominantByRegion);
    }

    Integer computeDominant(TerritoryGraph graph, int regionId) {
        List<Integer> children = graph.children(regionId);
        Map<Integer, Integer> childCounts = new TreeMap<>();
        for (int child : children) {
            Integer c = store.getControllingFaction(child);
            if (c != null) childCounts.merge(c, 1, Integer::sum);
        }

        Map<Integer, Integer> highValueCounts = new TreeMap<>();
        List<Integer> subtree = new ArrayList<>();
        subtree.add(regionId);
        subtree.addAll(graph.descendants(regionId));
        for (int id : subtree) {
            Territory t = graph.get(id);
            if (t == null || t.strategicValue() < config.dominanceHighValueThreshold()) continue;
            InfluenceSnapshot s = store.snapshot(id);
            if (s.controllerId() != null) highValueCounts.merge(s.controllerId(), 1, Integer::sum);
        }

        Set<Integer> factions = new TreeSet<>();
        factions.addAll(childCounts.keySet());
        factions.addAll(highValueCounts.keySet());

        Integer best = null;
        int bestChildren = -1;
        int bestHigh = -1;
        for (int f : factions) {
            int ch = childCounts.getOrDefault(f, 0);
            int hv = highValueCounts.getOrDefault(f, 0);
            boolean majority = !children.isEmpty() && ch * 2 > children.size();
            boolean highValue = hv >= config.dominanceHighValueCount();
            if (!majority && !highValue) continue;

            if (ch > bestChildren || (ch == bestChildren && hv > bestHigh)) {
                best = f;
                bestChildren = ch;
                bestHigh = hv;
            }
        }
        return best;
    }

    private static Integer regionOf(TerritoryGraph graph, Integer territoryId) {
        if (territoryId == null) return null;
        Territory t = graph.get(territoryId);
        if (t == null) return null;
        if (t.level() == TerritoryLevel.REGION) return t.id();
        List<Integer> ancestors = graph.ancestors(territoryId);
        if (ancestors.isEmpty()) return null;
        Integer top = ancestors.get(ancestors.size() - 1);
        Territory root = graph.get(top);
        return (root != null && root.level() == TerritoryLevel.REGION) ? top : null;
    }
}
