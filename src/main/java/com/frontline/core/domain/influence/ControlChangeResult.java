package com.frontline.core.domain.influence;

import java.util.Objects;

public record ControlChangeResult(
        int territoryId,
        int factionId,
        Integer oldControllerId,
        Integer newControllerId,
        boolean wasContested,
        boolean isContested,
        double appliedDelta,
        double resultingValue
) {
    public boolean controlChanged() {
        return !Objects.equals(oldControllerId, newControllerId);
    }

    public boolean becameContested() {
        return isContested && !wasContested;
    }
}
