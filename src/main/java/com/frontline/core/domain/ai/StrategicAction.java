package com.frontline.core.domain.ai;

import com.frontline.core.domain.influence.EventCause;

/**
 * Candidate moves a faction can score each tick.
 * Ordinal order is the last tie-break when two candidates score identically.
 */
public enum StrategicAction {
    EXPAND(EventCause.CAPTURE, 1.0),
    DEFEND(EventCause.DEFEND, 0.75),
    ATTACK(EventCause.CAPTURE, 1.0),
    FORTIFY(EventCause.REINFORCE, 0.5),
    PATROL(EventCause.REINFORCE, 0.25),
    RETREAT(EventCause.RETREAT, -0.5),
    NEGOTIATE(EventCause.NEGOTIATE, 0.2);

    private final EventCause cause;
    private final double magnitudeFactor;

    StrategicAction(EventCause cause, double magnitudeFactor) {
        this.cause = cause;
        this.magnitudeFactor = magnitudeFactor;
    }

    public EventCause cause() {
        return cause;
    }

    /** Signed share of the configured base magnitude this move applies to the acting faction. */
    public double magnitudeFactor() {
        return magnitudeFactor;
    }
}
