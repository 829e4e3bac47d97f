package com.frontline.core.domain.territory;

import java.util.List;

/**
 * Authored territory node. Static for the whole session.
 *
 * crossLinks are the explicit strategic corridors; sibling adjacency is derived
 * from the parent reference by {@link TerritoryGraph}.
 */
public record Territory(
        int id,
        String name,
        TerritoryLevel level,
        Integer parentId,
        List<Integer> crossLinks,
        int strategicValue,
        double resourceMultiplier,
        double decayRate
) {
    public Territory {
        crossLinks = (crossLinks != null) ? List.copyOf(crossLinks) : List.of();
        name = (name != null) ? name : ("Territory " + id);
    }

    public boolean isRoot() {
        return parentId == null;
    }
}
