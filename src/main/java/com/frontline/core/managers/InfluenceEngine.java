package com.frontline.core.managers;

import com.frontline.core.domain.errors.TerritorialValidationException;
import com.frontline.core.domain.feed.FeedEvent;
import com.frontline.core.domain.feed.FeedEventKind;
import com.frontline.core.domain.influence.ControlChangeResult;
import com.frontline.core.domain.influence.EventCause;
import com.frontline.core.domain.influence.EventPriority;
import com.frontline.core.domain.influence.InfluenceAction;
import com.frontline.core.domain.influence.InfluenceRecord;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.ports.IFeedPublisher;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Applies influence deltas and resolves their consequences.
 *
 * Per call:
 * 1) under the territory lock: write, append the event, publish ControlChanged/Contested/StrategicLoss
 * 2) lock released: run the cascade synchronously if control moved to a faction
 * 3) re-evaluate dominance for every territory whose controller moved
 *
 * No thread ever holds two territory locks, so cascades cannot deadlock each other.
 */
public final class InfluenceEngine {

    private final TerritoryStore store;
    private final TerritorialEventLog eventLog;
    private final CascadeEngine cascade;
    private final DominanceTracker dominance;
    private final IFeedPublisher publisher;
    private final TerritorialConfig config;
    private final EngineTelemetry telemetry;
    private final Clock clock;

    public InfluenceEngine(TerritoryStore store,
                           TerritorialEventLog eventLog,
                           CascadeEngine cascade,
                           DominanceTracker dominance,
                           IFeedPublisher publisher,
                           TerritorialConfig config,
                           EngineTelemetry telemetry,
                           Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.cascade = Objects.requireNonNull(cascade, "cascade");
        this.dominance = Objects.requireNonNull(dominance, "dominance");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.config = Objects.requireNonNull(config, "config");
        this.telemetry = (telemetry != null) ? telemetry : new EngineTelemetry();
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    public ControlChangeResult applyAction(int territoryId, int factionId, double rawDelta, EventCause cause, String actorId) {
        return applyAction(InfluenceAction.of(territoryId, factionId, rawDelta, cause, actorId));
    }

    /**
     * @throws TerritorialValidationException for unknown ids, a non-finite delta or a reserved cause;
     *                                        nothing is written in that case
     */
    public ControlChangeResult applyAction(InfluenceAction action) {
        validate(action);

        if (action.cause() == EventCause.DECAY) {
            return applyDecay(action.territoryId(), action.factionId(), -action.rawDelta());
        }

        int territoryId = action.territoryId();
        ControlChangeResult result = store.withTerritoryLock(territoryId, () -> {
            ControlChangeResult r = store.applyDelta(territoryId, action.factionId(), action.rawDelta(), action.refreshesHolder());
            eventLog.append(territoryId, action.factionId(), action.actorId(), action.sessionId(), action.cause(),
                    action.rawDelta(), r.appliedDelta(), r.resultingValue(),
                    r.controlChanged() ? EventPriority.HIGH : EventPriority.NORMAL,
                    r.controlChanged(), 0);
            publishTransitions(r, false);
            return r;
        });
        telemetry.actionApplied();

        if (result.controlChanged()) {
            telemetry.controlFlip();
            Set<Integer> changed = new LinkedHashSet<>();
            changed.add(territoryId);

            if (result.newControllerId() != null) {
                CascadeEngine.CascadeReport report = cascade.propagate(result,
                        (tid, fid, delta, wave) -> applyCascadeDelta(tid, fid, delta, wave, action));
                for (CascadeEngine.CascadeStep step : report.steps()) {
                    if (step.result() != null && step.result().controlChanged()) changed.add(step.territoryId());
                }
            }
            dominance.evaluate(changed);
        }
        return result;
    }

    /**
     * Passive loss. A flip caused here is published as a low-priority ControlChanged and
     * nothing else: no cascade, no Contested, no StrategicLoss, no dominance re-evaluation.
     */
    public ControlChangeResult applyDecay(int territoryId, int factionId, double amount) {
        return applyDecay(territoryId, factionId, amount, Long.MAX_VALUE);
    }

    /**
     * Decays the record only if it is still idle once the territory lock is held.
     *
     * @param idleSinceMs the record must not have been refreshed after this instant
     * @return null when the record was refreshed in the meantime or holds nothing; nothing is written then
     */
    public ControlChangeResult applyDecay(int territoryId, int factionId, double amount, long idleSinceMs) {
        store.requireTerritory(territoryId);
        store.requireFaction(factionId);
        double loss = Math.max(0.0, Double.isFinite(amount) ? amount : 0.0);

        ControlChangeResult result = store.withTerritoryLock(territoryId, () -> {
            if (idleSinceMs != Long.MAX_VALUE) {
                InfluenceRecord current = store.snapshot(territoryId).records().get(factionId);
                if (current == null || current.value() <= 0.0 || current.lastRefreshedMs() > idleSinceMs) {
                    return null;
                }
            }
            ControlChangeResult r = store.applyDelta(territoryId, factionId, -loss, false);
            eventLog.append(territoryId, factionId, "decay", null, EventCause.DECAY,
                    -loss, r.appliedDelta(), r.resultingValue(), EventPriority.LOW, r.controlChanged(), 0);
            if (r.controlChanged()) {
                publish(FeedEventKind.CONTROL_CHANGED, r, true);
            }
            return r;
        });
        if (result != null && result.controlChanged()) telemetry.controlFlip();
        return result;
    }

    /**
     * Administrative absolute write. Publishes like an action but never cascades.
     */
    public ControlChangeResult forceInfluence(int territoryId, int factionId, double value, String actorId) {
        store.requireTerritory(territoryId);
        store.requireFaction(factionId);
        if (Double.isNaN(value)) {
            telemetry.actionRejected();
            throw new TerritorialValidationException("Influence value must be a number");
        }

        ControlChangeResult result = store.withTerritoryLock(territoryId, () -> {
            double before = store.getInfluence(territoryId, factionId);
            ControlChangeResult r = store.write(territoryId, factionId, value, true);
            eventLog.append(territoryId, factionId, actorId, null, EventCause.ADMIN,
                    value - before, r.appliedDelta(), r.resultingValue(),
                    r.controlChanged() ? EventPriority.HIGH : EventPriority.NORMAL, r.controlChanged(), 0);
            publishTransitions(r, false);
            return r;
        });

        if (result.controlChanged()) {
            telemetry.controlFlip();
            dominance.evaluate(Set.of(territoryId));
        }
        return result;
    }

    private ControlChangeResult applyCascadeDelta(int territoryId, int factionId, double delta, int wave, InfluenceAction trigger) {
        ControlChangeResult r = store.withTerritoryLock(territoryId, () -> {
            ControlChangeResult res = store.applyDelta(territoryId, factionId, delta, false);
            eventLog.append(territoryId, factionId, trigger.actorId(), trigger.sessionId(), EventCause.CASCADE,
                    delta, res.appliedDelta(), res.resultingValue(),
                    res.controlChanged() ? EventPriority.HIGH : EventPriority.NORMAL, res.controlChanged(), wave);
            publishTransitions(res, false);
            return res;
        });
        if (r.controlChanged()) telemetry.controlFlip();
        return r;
    }

    private void publishTransitions(ControlChangeResult r, boolean lowPriority) {
        if (r.controlChanged()) {
            publish(FeedEventKind.CONTROL_CHANGED, r, lowPriority);

            Territory t = store.getTerritory(r.territoryId());
            if (r.oldControllerId() != null && t != null && t.strategicValue() >= config.strategicLossThreshold()) {
                publish(FeedEventKind.STRATEGIC_LOSS, r, lowPriority);
            }
        }
        if (r.becameContested()) {
            publish(FeedEventKind.CONTESTED, r, lowPriority);
        }
    }

    private void publish(FeedEventKind kind, ControlChangeResult r, boolean lowPriority) {
        Territory t = store.getTerritory(r.territoryId());
        FeedEvent event = new FeedEvent(
                kind,
                r.territoryId(),
                (t != null) ? t.name() : ("territory-" + r.territoryId()),
                r.oldControllerId(),
                r.newControllerId(),
                (t != null) ? t.strategicValue() : 0,
                r.isContested(),
                store.graph().connected(r.territoryId()),
                0L,
                lowPriority,
                clock.millis()
        );
        publisher.publish(event);
    }

    private void validate(InfluenceAction action) {
        try {
            if (action == null) throw new TerritorialValidationException("Action is required");
            store.requireTerritory(action.territoryId());
            store.requireFaction(action.factionId());
            if (action.cause() == null) {
                throw new TerritorialValidationException("Action cause is required");
            }
            if (action.cause() == EventCause.CASCADE) {
                throw new TerritorialValidationException("CASCADE deltas are produced internally only");
            }
            if (!Double.isFinite(action.rawDelta())) {
                throw new TerritorialValidationException("Delta must be finite: " + action.rawDelta());
            }
        } catch (TerritorialValidationException e) {
            telemetry.actionRejected();
            throw e;
        }
    }

    public TerritoryStore store() {
        return store;
    }

    public TerritorialEventLog eventLog() {
        return eventLog;
    }
}
