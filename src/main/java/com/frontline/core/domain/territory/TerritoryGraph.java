package com.frontline.core.domain.territory;

import com.frontline.core.domain.errors.GraphConsistencyException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable, validated territory hierarchy plus its connectivity.
 *
 * <ul>
 *   <li>connected: siblings under the same parent plus explicit cross-links</li>
 *   <li>cascade neighborhood: parent, children and cross-links</li>
 * </ul>
 * All neighbor lists are returned sorted by id so every walk over the graph is
 * deterministic.
 */
public final class TerritoryGraph {

    private final Map<Integer, Territory> territories;
    private final Map<Integer, List<Integer>> children;
    private final Map<Integer, List<Integer>> connected;
    private final Map<Integer, List<Integer>> cascadeNeighborhood;
    private final int maxCascadeDegree;

    private TerritoryGraph(Map<Integer, Territory> territories) {
        this.territories = Collections.unmodifiableMap(territories);

        Map<Integer, List<Integer>> childMap = new HashMap<>();
        for (Territory t : territories.values()) {
            if (t.parentId() != null) {
                childMap.computeIfAbsent(t.parentId(), k -> new ArrayList<>()).add(t.id());
            }
        }
        childMap.values().forEach(Collections::sort);
        this.children = freeze(childMap);

        Map<Integer, List<Integer>> conn = new HashMap<>();
        Map<Integer, List<Integer>> cascade = new HashMap<>();
        int maxDegree = 0;
        for (Territory t : territories.values()) {
            Set<Integer> c = new TreeSet<>(t.crossLinks());
            if (t.parentId() != null) {
                for (Integer sibling : children.getOrDefault(t.parentId(), List.of())) {
                    if (sibling != t.id()) c.add(sibling);
                }
            }
            conn.put(t.id(), List.copyOf(c));

            Set<Integer> n = new TreeSet<>(t.crossLinks());
            if (t.parentId() != null) n.add(t.parentId());
            n.addAll(children.getOrDefault(t.id(), List.of()));
            cascade.put(t.id(), List.copyOf(n));
            maxDegree = Math.max(maxDegree, n.size());
        }
        this.connected = Collections.unmodifiableMap(conn);
        this.cascadeNeighborhood = Collections.unmodifiableMap(cascade);
        this.maxCascadeDegree = maxDegree;
    }

    /**
     * Validates and builds a graph.
     *
     * @throws GraphConsistencyException if any hierarchy or link invariant is broken
     */
    public static TerritoryGraph build(Collection<Territory> territories) {
        List<String> problems = TerritoryGraphValidator.validate(territories);
        if (!problems.isEmpty()) {
            throw new GraphConsistencyException(problems);
        }

        Map<Integer, Territory> byId = new TreeMap<>();
        for (Territory t : territories) byId.put(t.id(), t);
        return new TerritoryGraph(byId);
    }

    public static TerritoryGraph empty() {
        return new TerritoryGraph(new TreeMap<>());
    }

    public Territory get(int territoryId) {
        return territories.get(territoryId);
    }

    public boolean contains(int territoryId) {
        return territories.containsKey(territoryId);
    }

    public Collection<Territory> all() {
        return territories.values();
    }

    public Set<Integer> ids() {
        return territories.keySet();
    }

    public int size() {
        return territories.size();
    }

    public List<Integer> children(int territoryId) {
        return children.getOrDefault(territoryId, List.of());
    }

    public List<Integer> connected(int territoryId) {
        return connected.getOrDefault(territoryId, List.of());
    }

    public List<Integer> cascadeNeighborhood(int territoryId) {
        return cascadeNeighborhood.getOrDefault(territoryId, List.of());
    }

    /**
     * Degree centrality in the cascade graph, normalized to [0,1] by the
     * best-connected territory.
     */
    public double centrality(int territoryId) {
        if (maxCascadeDegree == 0) return 0.0;
        return cascadeNeighborhood(territoryId).size() / (double) maxCascadeDegree;
    }

    /**
     * Parent chain, nearest first.
     */
    public List<Integer> ancestors(int territoryId) {
        List<Integer> out = new ArrayList<>();
        Territory cur = territories.get(territoryId);
        while (cur != null && cur.parentId() != null) {
            out.add(cur.parentId());
            cur = territories.get(cur.parentId());
        }
        return out;
    }

    public Set<Integer> descendants(int territoryId) {
        Set<Integer> out = new LinkedHashSet<>();
        List<Integer> frontier = new ArrayList<>(children(territoryId));
        while (!frontier.isEmpty()) {
            Integer next = frontier.remove(frontier.size() - 1);
            if (out.add(next)) frontier.addAll(children(next));
        }
        return out;
    }

    private static Map<Integer, List<Integer>> freeze(Map<Integer, List<Integer>> map) {
        Map<Integer, List<Integer>> out = new HashMap<>();
        map.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(out);
    }
}
