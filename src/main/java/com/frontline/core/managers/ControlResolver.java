package com.frontline.core.managers;

import com.frontline.core.domain.influence.InfluenceRecord;

import java.util.Map;

/**
 * Derives controller and contested status from a territory's influence set.
 *
 * Controller: the highest value at or above the control threshold; equal
 * values resolve to the lower faction id. Contested: two or more factions at
 * or above the contest threshold.
 */
public final class ControlResolver {

    private final double controlThreshold;
    private final double contestThreshold;

    public ControlResolver(double controlThreshold, double contestThreshold) {
        this.controlThreshold = controlThreshold;
        this.contestThreshold = contestThreshold;
    }

    public Resolution resolve(Map<Integer, InfluenceRecord> records) {
        Integer top = null;
        double topValue = Double.NEGATIVE_INFINITY;
        int contenders = 0;

        for (InfluenceRecord r : records.values()) {
            double v = r.value();
            if (v >= contestThreshold && v > 0.0) contenders++;

            if (v > topValue || (v == topValue && top != null && r.factionId() < top)) {
                top = r.factionId();
                topValue = v;
            }
        }

        Integer controller = (top != null && topValue >= controlThreshold && topValue > 0.0) ? top : null;
        return new Resolution(controller, contenders >= 2);
    }

    public double controlThreshold() {
        return controlThreshold;
    }

    public double contestThreshold() {
        return contestThreshold;
    }

    public record Resolution(Integer controllerId, boolean contested) {}
}
