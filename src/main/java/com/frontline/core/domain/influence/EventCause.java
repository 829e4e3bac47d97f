package com.frontline.core.domain.influence;

/**
 * Why an influence value moved. Passive causes do not count as a refresh for the decay grace window.
 */
public enum EventCause {
    CAPTURE,
    DEFEND,
    REINFORCE,
    SABOTAGE,
    RETREAT,
    NEGOTIATE,
    CASCADE,
    DECAY,
    ADMIN;

    public boolean isPassive() {
        return this == DECAY || this == CASCADE;
    }

    /** Sabotage lands on a rival's record, so it never counts as the holder's activity. */
    public boolean refreshesHolder() {
        return !isPassive() && this != SABOTAGE;
    }
}
