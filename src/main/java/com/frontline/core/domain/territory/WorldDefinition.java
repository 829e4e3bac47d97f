package com.frontline.core.domain.territory;

import com.frontline.core.domain.factions.FactionDefinition;

import java.util.List;

public record WorldDefinition(
        List<Territory> territories,
        List<FactionDefinition> factions
) {
    public WorldDefinition {
        territories = (territories != null) ? List.copyOf(territories) : List.of();
        factions = (factions != null) ? List.copyOf(factions) : List.of();
    }
}
