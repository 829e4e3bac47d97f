package com.frontline.core.managers;

import com.frontline.core.domain.errors.TerritorialValidationException;
import com.frontline.core.domain.feed.FeedEvent;
import com.frontline.core.domain.feed.FeedEventKind;
import com.frontline.core.domain.influence.ControlChangeResult;
import com.frontline.core.domain.influence.EventCause;
import com.frontline.core.domain.influence.EventPriority;
import com.frontline.core.domain.influence.InfluenceSnapshot;
import com.frontline.core.domain.influence.TerritorialEvent;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.support.EngineHarness;
import com.frontline.core.synchronization.FeedSubscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.frontline.core.support.TestWorlds.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behavior of a single influence action: write, audit, feed, cascade.
 */
class InfluenceEngineTest {

    private static long seedWhereFirstRoll(boolean below, double p) {
        for (long seed = 0; ; seed++) {
            if ((new Random(seed).nextDouble() < p) == below) return seed;
        }
    }

    private static List<FeedEvent> kinds(List<FeedEvent> events, int territoryId) {
        return events.stream().filter(e -> e.territoryId() == territoryId).toList();
    }

    @Nested
    @DisplayName("Capture with cascade")
    class CaptureWithCascade {

        // default cascade tuning: dampening * sv/10 * distance * centrality * reinforcement; moves on rebalance
        private static final double EXPECTED_P = 0.6 * 0.8 * 1.0 * 1.0 * 1.5;

        private EngineHarness seeded(long seed) {
            EngineHarness h = new EngineHarness(linkedPair(), factions(FACTION_A, FACTION_B), seed);
            h.store.setInfluence(1, FACTION_A, 55);
            h.store.setInfluence(1, FACTION_B, 45);
            h.store.setInfluence(2, FACTION_B, 30);
            return h;
        }

        @Test
        @DisplayName("B +20 on a 55/45 territory flips control and reinforces the linked neighbor")
        void flipAndCascade() {
            EngineHarness h = seeded(seedWhereFirstRoll(true, EXPECTED_P));
            FeedSubscription sub = h.feed.subscribe();

            ControlChangeResult r = h.engine.applyAction(1, FACTION_B, 20, EventCause.CAPTURE, "session-7");

            assertEquals(65.0, r.resultingValue(), 1e-9);
            assertNull(r.oldControllerId());
            assertEquals(FACTION_B, r.newControllerId());
            assertEquals(FACTION_B, h.store.getControllingFaction(1));
            assertEquals(30.0 + 8 * EXPECTED_P, h.store.getInfluence(2, FACTION_B), 1e-9);
            assertEquals(35.76, h.store.getInfluence(2, FACTION_B), 1e-9);

            List<FeedEvent> published = sub.drain();
            List<FeedEvent> origin = kinds(published, 1);
            assertEquals(1, origin.size());
            assertEquals(FeedEventKind.CONTROL_CHANGED, origin.get(0).kind());
            assertEquals(List.of(2), origin.get(0).connectedTerritoryIds());
            assertTrue(kinds(published, 2).isEmpty());

            List<TerritorialEvent> log = h.eventLog.all();
            assertEquals(2, log.size());
            assertEquals(EventCause.CAPTURE, log.get(0).cause());
            assertEquals(EventPriority.HIGH, log.get(0).priority());
            assertEquals("session-7", log.get(0).actorId());
            assertEquals(EventCause.CASCADE, log.get(1).cause());
            assertEquals(1, log.get(1).cascadeWave());
            assertEquals(2, log.get(1).territoryId());
        }

        @Test
        @DisplayName("A failed cascade roll leaves the neighbor untouched")
        void rollMisses() {
            EngineHarness h = seeded(seedWhereFirstRoll(false, EXPECTED_P));

            h.engine.applyAction(1, FACTION_B, 20, EventCause.CAPTURE, "session-7");

            assertEquals(30.0, h.store.getInfluence(2, FACTION_B), 1e-9);
            assertEquals(1, h.eventLog.size());
            assertEquals(1, h.telemetry.getCascadesRun());
            assertEquals(0, h.telemetry.getCascadeDeltasApplied());
        }

        @Test
        @DisplayName("The same seed produces the same final state")
        void reproducible() {
            long seed = 1234L;
            EngineHarness first = seeded(seed);
            EngineHarness second = seeded(seed);

            first.engine.applyAction(1, FACTION_B, 20, EventCause.CAPTURE, "s");
            second.engine.applyAction(1, FACTION_B, 20, EventCause.CAPTURE, "s");

            for (int tid : List.of(1, 2)) {
                InfluenceSnapshot a = first.store.snapshot(tid);
                InfluenceSnapshot b = second.store.snapshot(tid);
                assertEquals(a.values(), b.values());
                assertEquals(a.controllerId(), b.controllerId());
            }
        }
    }

    @Nested
    @DisplayName("Feed transitions")
    class Transitions {

        private EngineHarness h;
        private FeedSubscription sub;

        @BeforeEach
        void setUp() {
            h = new EngineHarness(linkedPair(), factions(FACTION_A, FACTION_B), 99L);
            sub = h.feed.subscribe();
        }

        @Test
        @DisplayName("A sub-threshold delta is logged but publishes nothing")
        void subThresholdIsQuiet() {
            ControlChangeResult r = h.engine.applyAction(1, FACTION_A, 10, EventCause.REINFORCE, "s");

            assertFalse(r.controlChanged());
            assertTrue(sub.drain().isEmpty());
            assertEquals(1, h.eventLog.size());
            assertEquals(EventPriority.NORMAL, h.eventLog.all().get(0).priority());
            assertEquals(0, h.telemetry.getCascadesRun());
        }

        @Test
        @DisplayName("Losing a high-value territory publishes StrategicLoss after ControlChanged")
        void strategicLoss() {
            h.store.setInfluence(1, FACTION_A, 70);
            h.store.setInfluence(1, FACTION_B, 50);

            h.engine.applyAction(1, FACTION_B, 30, EventCause.CAPTURE, "s");

            List<FeedEvent> origin = kinds(sub.drain(), 1);
            assertEquals(List.of(FeedEventKind.CONTROL_CHANGED, FeedEventKind.STRATEGIC_LOSS),
                    origin.stream().map(FeedEvent::kind).toList());
            assertEquals(FACTION_A, origin.get(1).previousControllerId());
            assertEquals(FACTION_B, origin.get(1).newControllerId());
            assertEquals(1L, origin.get(0).sequence());
            assertEquals(2L, origin.get(1).sequence());
        }

        @Test
        @DisplayName("Losing a low-value territory publishes only ControlChanged")
        void lowValueLossHasNoStrategicLoss() {
            h.store.setInfluence(2, FACTION_A, 70);

            h.engine.applyAction(2, FACTION_A, -20, EventCause.RETREAT, "s");

            assertEquals(List.of(FeedEventKind.CONTROL_CHANGED),
                    kinds(sub.drain(), 2).stream().map(FeedEvent::kind).toList());
            assertNull(h.store.getControllingFaction(2));
        }

        @Test
        @DisplayName("Becoming contested publishes Contested once")
        void contested() {
            h.store.setInfluence(2, FACTION_A, 45);

            h.engine.applyAction(2, FACTION_B, 40, EventCause.CAPTURE, "s");
            h.engine.applyAction(2, FACTION_B, 5, EventCause.CAPTURE, "s");

            List<FeedEvent> events = sub.drain();
            assertEquals(1, events.size());
            assertEquals(FeedEventKind.CONTESTED, events.get(0).kind());
            assertTrue(events.get(0).contested());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        private EngineHarness h;

        @BeforeEach
        void setUp() {
            h = new EngineHarness(linkedPair(), factions(FACTION_A, FACTION_B), 1L);
        }

        @Test
        @DisplayName("Unknown ids are rejected before anything is written")
        void unknownIds() {
            assertThrows(TerritorialValidationException.class,
                    () -> h.engine.applyAction(42, FACTION_A, 10, EventCause.CAPTURE, "s"));
            assertThrows(TerritorialValidationException.class,
                    () -> h.engine.applyAction(1, 9, 10, EventCause.CAPTURE, "s"));

            assertEquals(0, h.eventLog.size());
            assertEquals(2, h.telemetry.getActionsRejected());
        }

        @Test
        @DisplayName("Cascade deltas cannot be submitted from outside")
        void cascadeCauseReserved() {
            assertThrows(TerritorialValidationException.class,
                    () -> h.engine.applyAction(1, FACTION_A, 10, EventCause.CASCADE, "s"));
        }

        @Test
        @DisplayName("Non-finite deltas are rejected")
        void nonFinite() {
            assertThrows(TerritorialValidationException.class,
                    () -> h.engine.applyAction(1, FACTION_A, Double.NaN, EventCause.CAPTURE, "s"));
            assertThrows(TerritorialValidationException.class,
                    () -> h.engine.applyAction(1, FACTION_A, Double.POSITIVE_INFINITY, EventCause.CAPTURE, "s"));
        }
    }

    @Test
    @DisplayName("A decay action is applied as a low-priority loss")
    void decayRouted() {
        EngineHarness h = new EngineHarness(linkedPair(), factions(FACTION_A), 1L);
        h.store.setInfluence(2, FACTION_A, 20);

        h.engine.applyAction(2, FACTION_A, -4, EventCause.DECAY, "decay");

        assertEquals(16.0, h.store.getInfluence(2, FACTION_A), 1e-9);
        assertEquals(EventPriority.LOW, h.eventLog.all().get(0).priority());
    }

    @Test
    @DisplayName("Random action streams keep every value in range and control consistent")
    void randomStreamKeepsInvariants() {
        EngineHarness h = new EngineHarness(smallHierarchy(), factions(FACTION_A, FACTION_B, FACTION_C), 7L);
        Random ops = new Random(2024L);
        List<Integer> ids = List.copyOf(h.store.graph().ids());
        EventCause[] causes = {EventCause.CAPTURE, EventCause.DEFEND, EventCause.REINFORCE, EventCause.SABOTAGE, EventCause.RETREAT};

        for (int i = 0; i < 500; i++) {
            int tid = ids.get(ops.nextInt(ids.size()));
            int fid = 1 + ops.nextInt(3);
            double delta = ops.nextDouble() * 80.0 - 35.0;
            h.engine.applyAction(tid, fid, delta, causes[ops.nextInt(causes.length)], "fuzz");
        }

        ControlResolver resolver = new ControlResolver(60.0, 40.0);
        for (Territory t : h.store.graph().all()) {
            InfluenceSnapshot s = h.store.snapshot(t.id());
            for (double v : s.values().values()) {
                assertTrue(v >= 0.0 && v <= 100.0, "value out of range: " + v);
            }
            assertEquals(resolver.resolve(s.records()), new ControlResolver.Resolution(s.controllerId(), s.contested()));
        }
    }
}
