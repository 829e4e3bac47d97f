package com.frontline.core.managers;

import com.frontline.core.domain.influence.EventCause;
import com.frontline.core.domain.influence.InfluenceAction;
import com.frontline.core.domain.influence.InfluenceSnapshot;
import com.frontline.core.domain.influence.TerritorialEvent;
import com.frontline.core.domain.territory.TerritoryLevel;
import com.frontline.core.support.EngineHarness;
import com.frontline.core.support.MutableClock;
import com.frontline.core.synchronization.DecayScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.frontline.core.support.TestWorlds.*;
import static org.junit.jupiter.api.Assertions.*;

class EventReplayerTest {

    @Test
    @DisplayName("Replaying the event log rebuilds the exact influence state, cascades included")
    void replayRebuildsState() {
        EngineHarness h = new EngineHarness(smallHierarchy(), factions(FACTION_A, FACTION_B, FACTION_C), 11L);
        h.engine.forceInfluence(101, FACTION_B, 45, "admin");
        h.engine.forceInfluence(110, FACTION_A, 30, "admin");
        h.engine.applyAction(101, FACTION_A, 62, EventCause.CAPTURE, "s1");
        h.engine.applyAction(110, FACTION_B, 70, EventCause.CAPTURE, "s2");
        h.engine.applyAction(10, FACTION_C, 61, EventCause.CAPTURE, "s3");
        h.engine.applyAction(101, FACTION_B, 25, EventCause.SABOTAGE, "s2");
        h.engine.applyAction(1, FACTION_A, 65, EventCause.CAPTURE, "s1");

        TerritoryStore rebuilt = store(smallHierarchy(), factions(FACTION_A, FACTION_B, FACTION_C), new MutableClock(0L));
        List<TerritorialEvent> shuffled = new ArrayList<>(h.eventLog.all());
        Collections.reverse(shuffled);

        int applied = new EventReplayer(rebuilt).replay(shuffled);

        assertEquals(h.eventLog.size(), applied);
        for (int id : h.store.graph().ids()) {
            InfluenceSnapshot expected = h.store.snapshot(id);
            InfluenceSnapshot actual = rebuilt.snapshot(id);
            assertEquals(expected.values(), actual.values(), "territory " + id);
            assertEquals(expected.controllerId(), actual.controllerId(), "territory " + id);
            assertEquals(expected.contested(), actual.contested(), "territory " + id);
        }
    }

    @Test
    @DisplayName("Replayed decay events keep their original refresh time")
    void passiveEventsDoNotRefresh() {
        EngineHarness h = new EngineHarness(
                List.of(decaying(1, TerritoryLevel.REGION, null, 5, 4.0)),
                factions(FACTION_A), 1L);
        h.engine.applyAction(1, FACTION_A, 40, EventCause.CAPTURE, "s");
        h.clock.advance(Duration.ofMinutes(5));
        new DecayScheduler(h.engine, h.config, h.telemetry, h.clock).sweep();

        MutableClock replayClock = new MutableClock(h.clock.millis());
        TerritoryStore rebuilt = store(List.of(decaying(1, TerritoryLevel.REGION, null, 5, 4.0)), factions(FACTION_A), replayClock);
        replayClock.advance(Duration.ofMinutes(-5));
        new EventReplayer(rebuilt).replay(h.eventLog.all().subList(0, 1));
        long refreshed = rebuilt.snapshot(1).records().get(FACTION_A).lastRefreshedMs();
        replayClock.advance(Duration.ofMinutes(5));

        new EventReplayer(rebuilt).replay(h.eventLog.all().subList(1, 2));

        assertEquals(36.0, rebuilt.getInfluence(1, FACTION_A), 1e-9);
        assertEquals(refreshed, rebuilt.snapshot(1).records().get(FACTION_A).lastRefreshedMs());
    }

    @Test
    @DisplayName("Replayed sabotage keeps the victim's refresh time")
    void sabotageDoesNotRefresh() {
        EngineHarness h = new EngineHarness(
                List.of(decaying(1, TerritoryLevel.REGION, null, 5, 4.0)),
                factions(FACTION_A, FACTION_B), 1L);
        h.engine.applyAction(1, FACTION_B, 50, EventCause.CAPTURE, "s-b");
        h.clock.advance(Duration.ofMinutes(5));
        h.engine.applyAction(new InfluenceAction(1, FACTION_B, -10, EventCause.SABOTAGE, "s-a", "s-a", FACTION_A));

        MutableClock replayClock = new MutableClock(1_000_000L);
        TerritoryStore rebuilt = store(List.of(decaying(1, TerritoryLevel.REGION, null, 5, 4.0)),
                factions(FACTION_A, FACTION_B), replayClock);
        new EventReplayer(rebuilt).replay(h.eventLog.all().subList(0, 1));
        replayClock.advance(Duration.ofMinutes(5));

        new EventReplayer(rebuilt).replay(h.eventLog.all().subList(1, 2));

        assertEquals(40.0, rebuilt.getInfluence(1, FACTION_B), 1e-9);
        assertEquals(1_000_000L, rebuilt.snapshot(1).records().get(FACTION_B).lastRefreshedMs());
    }

    @Test
    @DisplayName("Events for territories outside the loaded world are skipped")
    void unknownTerritoriesSkipped() {
        EngineHarness h = new EngineHarness(smallHierarchy(), factions(FACTION_A), 1L);
        h.engine.applyAction(110, FACTION_A, 20, EventCause.CAPTURE, "s");
        h.engine.applyAction(1, FACTION_A, 20, EventCause.CAPTURE, "s");

        TerritoryStore partial = store(List.of(territory(1, TerritoryLevel.REGION, null, 6)), factions(FACTION_A), new MutableClock(0L));

        assertEquals(1, new EventReplayer(partial).replay(h.eventLog.all()));
        assertEquals(20.0, partial.getInfluence(1, FACTION_A), 1e-9);
    }
}
