package com.frontline.core.domain.feed;

public enum FeedEventKind {
    CONTROL_CHANGED("ControlChanged"),
    CONTESTED("Contested"),
    DOMINANCE("Dominance"),
    STRATEGIC_LOSS("StrategicLoss");

    private final String wireName;

    FeedEventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static FeedEventKind fromWireName(String raw) {
        if (raw == null) return null;
        for (FeedEventKind k : values()) {
            if (k.wireName.equalsIgnoreCase(raw.trim()) || k.name().equalsIgnoreCase(raw.trim())) return k;
        }
        return null;
    }
}
