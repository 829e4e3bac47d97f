package com.frontline.core.domain.territory;

import java.util.Locale;

public enum TerritoryLevel {
    REGION(1),
    DISTRICT(2),
    ZONE(3),
    OUTPOST(4);

    private final int depth;

    TerritoryLevel(int depth) {
        this.depth = depth;
    }

    public int depth() {
        return depth;
    }

    public boolean isDirectParentOf(TerritoryLevel child) {
        return child != null && child.depth == this.depth + 1;
    }

    public static TerritoryLevel parse(String raw, TerritoryLevel fallback) {
        if (raw == null) return fallback;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        if (v.isBlank()) return fallback;
        try {
            return TerritoryLevel.valueOf(v);
        } catch (IllegalArgumentException ignored) {
            return fallback;
        }
    }

    public static TerritoryLevel fromDepth(int depth) {
        for (TerritoryLevel l : values()) {
            if (l.depth == depth) return l;
        }
        return null;
    }
}
