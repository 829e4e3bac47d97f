package com.frontline.core.synchronization;

import com.frontline.core.domain.errors.TerritorialValidationException;
import com.frontline.core.domain.factions.FactionDefinition;
import com.frontline.core.domain.feed.FeedEvent;
import com.frontline.core.domain.influence.ActionKind;
import com.frontline.core.domain.influence.ActionRequest;
import com.frontline.core.domain.influence.ControlChangeResult;
import com.frontline.core.domain.influence.InfluenceAction;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.managers.TerritoryStore;
import com.frontline.core.synchronization.wire.FeedCodec;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Boundary for external sessions: actions in, feed out.
 *
 * Session actions are translated into the same {@link InfluenceAction} the faction
 * loops emit and go through the same {@link ActionQueue}.
 */
public class SyncService {

    private final TerritoryStore store;
    private final ActionQueue queue;
    private final TerritorialFeed feed;
    private final FeedCodec codec;
    private final TerritorialConfig config;
    private final Clock clock;

    public SyncService(TerritoryStore store, ActionQueue queue, TerritorialFeed feed,
                       FeedCodec codec, TerritorialConfig config, Clock clock) {
        this.store = store;
        this.queue = queue;
        this.feed = feed;
        this.codec = (codec != null) ? codec : new FeedCodec();
        this.config = config;
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    // --- OUTBOUND ---

    public FeedSubscription subscribe() {
        return feed.subscribe();
    }

    public FeedSubscription subscribe(FeedObserver observer) {
        return feed.subscribe(observer);
    }

    public List<FeedEvent> replay(int territoryId, long fromSequence) {
        return feed.replay(territoryId, fromSequence);
    }

    public String encode(FeedEvent event) {
        return codec.encode(event);
    }

    // --- INBOUND ---

    /** Session action with the default magnitude. */
    public CompletableFuture<ControlChangeResult> submitAction(int territoryId, int factionId, ActionKind kind, String actorSessionId) {
        return submitAction(new ActionRequest(territoryId, factionId, kind, config.decisionBaseMagnitude(),
                actorSessionId, clock.millis()));
    }

    public CompletableFuture<ControlChangeResult> submitAction(ActionRequest request) {
        return queue.submit(translate(request));
    }

    /** Raw JSON from a socket bridge. Malformed input is a validation error. */
    public CompletableFuture<ControlChangeResult> submitJson(String json) {
        return submitAction(codec.decodeAction(json));
    }

    /**
     * rawDelta = magnitude * kind weight * faction influence modifier.
     * Sabotage lowers the strongest rival of the actor's faction instead of raising the actor.
     */
    InfluenceAction translate(ActionRequest request) {
        if (request == null) throw new TerritorialValidationException("Action is required");
        if (request.kind() == null) throw new TerritorialValidationException("Action kind is required");
        if (!Double.isFinite(request.magnitude()) || request.magnitude() < 0.0) {
            throw new TerritorialValidationException("Magnitude must be a finite, non-negative number: " + request.magnitude());
        }

        store.requireTerritory(request.territoryId());
        FactionDefinition faction = store.requireFaction(request.factionId());

        double delta = request.magnitude() * request.kind().weight() * faction.influenceModifier();
        int targetFaction = request.factionId();

        if (request.kind().targetsRival()) {
            Integer rival = store.snapshot(request.territoryId()).strongestRival(request.factionId());
            if (rival == null) {
                throw new TerritorialValidationException("No rival influence to sabotage in territory " + request.territoryId());
            }
            targetFaction = rival;
            delta = -delta;
        }

        return new InfluenceAction(request.territoryId(), targetFaction, delta, request.kind().cause(),
                request.actorId(), request.actorId(), request.factionId());
    }
}
