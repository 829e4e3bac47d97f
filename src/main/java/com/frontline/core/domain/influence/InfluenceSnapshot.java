package com.frontline.core.domain.influence;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable view of one territory's influence set at a single point in time.
 */
public record InfluenceSnapshot(
        int territoryId,
        Map<Integer, InfluenceRecord> records,
        Integer controllerId,
        boolean contested,
        long version
) {
    public InfluenceSnapshot {
        records = Collections.unmodifiableMap(new TreeMap<>(records != null ? records : Map.of()));
    }

    public static InfluenceSnapshot empty(int territoryId) {
        return new InfluenceSnapshot(territoryId, Map.of(), null, false, 0L);
    }

    public double influenceOf(int factionId) {
        InfluenceRecord r = records.get(factionId);
        return (r != null) ? r.value() : 0.0;
    }

    public boolean hasInfluence(int factionId) {
        return influenceOf(factionId) > 0.0;
    }

    public Map<Integer, Double> values() {
        Map<Integer, Double> out = new TreeMap<>();
        records.forEach((k, v) -> out.put(k, v.value()));
        return out;
    }

    public List<Integer> factionsAtOrAbove(double threshold) {
        return records.values().stream()
                .filter(r -> r.value() >= threshold)
                .map(InfluenceRecord::factionId)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Highest-influence faction other than {@code factionId}; ties go to the lower id.
     */
    public Integer strongestRival(int factionId) {
        Integer best = null;
        double bestValue = 0.0;
        for (InfluenceRecord r : records.values()) {
            if (r.factionId() == factionId || r.value() <= 0.0) continue;
            if (best == null || r.value() > bestValue) {
                best = r.factionId();
                bestValue = r.value();
            }
        }
        return best;
    }
}
