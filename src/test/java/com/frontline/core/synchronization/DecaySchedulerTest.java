package com.frontline.core.synchronization;

import com.frontline.core.domain.feed.FeedEvent;
import com.frontline.core.domain.feed.FeedEventKind;
import com.frontline.core.domain.influence.EventCause;
import com.frontline.core.domain.influence.EventPriority;
import com.frontline.core.domain.influence.InfluenceAction;
import com.frontline.core.domain.influence.TerritorialEvent;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.TerritoryLevel;
import com.frontline.core.support.EngineHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.frontline.core.support.TestWorlds.*;
import static org.junit.jupiter.api.Assertions.*;

class DecaySchedulerTest {

    private EngineHarness h;
    private DecayScheduler decay;

    @BeforeEach
    void setUp() {
        List<Territory> world = List.of(
                decaying(1, TerritoryLevel.REGION, null, 8, 5.0, 2),
                decaying(2, TerritoryLevel.REGION, null, 3, 0.0, 1)
        );
        h = new EngineHarness(world, factions(FACTION_A, FACTION_B), 3L);
        decay = new DecayScheduler(h.engine, h.config, h.telemetry, h.clock);
    }

    @AfterEach
    void tearDown() {
        decay.stop();
    }

    @Test
    @DisplayName("Recently refreshed influence is inside the grace window")
    void graceWindow() {
        h.store.setInfluence(1, FACTION_A, 62);
        h.clock.advance(Duration.ofSeconds(60));

        DecayScheduler.SweepReport report = decay.sweep();

        assertEquals(0, report.decayed());
        assertEquals(62.0, h.store.getInfluence(1, FACTION_A), 1e-9);
        assertEquals(1, h.telemetry.getDecaySweeps());
    }

    @Test
    @DisplayName("Idle influence decays monotonically down to zero and stays there")
    void monotonicDecay() {
        h.store.setInfluence(1, FACTION_A, 12);
        double previous = 12.0;

        for (int i = 0; i < 6; i++) {
            h.clock.advance(Duration.ofSeconds(130));
            decay.sweep();
            double now = h.store.getInfluence(1, FACTION_A);
            assertTrue(now <= previous, "influence rose from " + previous + " to " + now);
            previous = now;
        }

        assertEquals(0.0, previous, 1e-9);
        assertEquals(3, h.eventLog.size());
    }

    @Test
    @DisplayName("Territories with a zero rate never decay")
    void zeroRate() {
        h.store.setInfluence(2, FACTION_B, 50);
        h.clock.advance(Duration.ofMinutes(30));

        decay.sweep();

        assertEquals(50.0, h.store.getInfluence(2, FACTION_B), 1e-9);
    }

    @Test
    @DisplayName("A decay flip is published at low priority and never cascades")
    void decayFlipIsQuiet() {
        h.store.setInfluence(1, FACTION_A, 62);
        h.store.setInfluence(1, FACTION_B, 61);
        FeedSubscription sub = h.feed.subscribe();
        h.clock.advance(Duration.ofSeconds(130));

        DecayScheduler.SweepReport report = decay.sweep();

        // A drops to 57 handing control to B, then B drops to 56
        assertEquals(2, report.decayed());
        assertEquals(2, report.flips());
        assertNull(h.store.getControllingFaction(1));

        List<FeedEvent> events = sub.drain();
        assertEquals(2, events.size());
        assertTrue(events.stream().allMatch(e -> e.kind() == FeedEventKind.CONTROL_CHANGED && e.lowPriority()));

        assertEquals(0.0, h.store.getInfluence(2, FACTION_B), 1e-9);
        assertEquals(0, h.telemetry.getCascadesRun());

        for (TerritorialEvent e : h.eventLog.all()) {
            assertEquals(EventCause.DECAY, e.cause());
            assertEquals(EventPriority.LOW, e.priority());
            assertEquals(-5.0, e.appliedDelta(), 1e-9);
        }
    }

    @Test
    @DisplayName("Decay does not refresh the grace window")
    void decayDoesNotRefresh() {
        h.store.setInfluence(1, FACTION_A, 50);
        long refreshedAt = h.store.snapshot(1).records().get(FACTION_A).lastRefreshedMs();
        h.clock.advance(Duration.ofSeconds(130));

        decay.sweep();

        assertEquals(refreshedAt, h.store.snapshot(1).records().get(FACTION_A).lastRefreshedMs());
    }

    @Test
    @DisplayName("Sabotage does not restart the victim's grace window")
    void sabotageKeepsVictimIdle() {
        h.engine.applyAction(1, FACTION_B, 50, EventCause.CAPTURE, "session-b");
        h.clock.advance(Duration.ofSeconds(300));

        h.engine.applyAction(new InfluenceAction(1, FACTION_B, -10, EventCause.SABOTAGE, "session-a", "session-a", FACTION_A));

        assertEquals(1_000_000L, h.store.snapshot(1).records().get(FACTION_B).lastRefreshedMs());
        DecayScheduler.SweepReport report = decay.sweep();
        assertEquals(1, report.decayed());
        assertEquals(35.0, h.store.getInfluence(1, FACTION_B), 1e-9);
    }

    @Test
    @DisplayName("The holder's own action restarts the grace window")
    void ownActionRefreshes() {
        h.engine.applyAction(1, FACTION_B, 50, EventCause.CAPTURE, "session-b");
        h.clock.advance(Duration.ofSeconds(300));

        h.engine.applyAction(1, FACTION_B, 5, EventCause.REINFORCE, "session-b");

        assertEquals(0, decay.sweep().decayed());
        assertEquals(55.0, h.store.getInfluence(1, FACTION_B), 1e-9);
    }

    @Test
    @DisplayName("A record refreshed after the sweep looked at it is left alone")
    void refreshedUnderLockIsSkipped() {
        h.store.setInfluence(1, FACTION_A, 30);
        h.clock.advance(Duration.ofSeconds(300));
        long idleSince = h.clock.millis() - h.config.decayGraceMs();
        h.engine.applyAction(1, FACTION_A, 5, EventCause.DEFEND, "session-a");
        int logged = h.eventLog.size();

        assertNull(h.engine.applyDecay(1, FACTION_A, 5.0, idleSince));

        assertEquals(35.0, h.store.getInfluence(1, FACTION_A), 1e-9);
        assertEquals(logged, h.eventLog.size());
    }

    @Test
    @DisplayName("An idle record is decayed by the guarded path")
    void idleUnderLockIsDecayed() {
        h.store.setInfluence(1, FACTION_A, 30);
        h.clock.advance(Duration.ofSeconds(300));

        assertNotNull(h.engine.applyDecay(1, FACTION_A, 5.0, h.clock.millis() - h.config.decayGraceMs()));

        assertEquals(25.0, h.store.getInfluence(1, FACTION_A), 1e-9);
    }
}
