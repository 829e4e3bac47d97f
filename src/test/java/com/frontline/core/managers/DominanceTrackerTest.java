package com.frontline.core.managers;

import com.frontline.core.domain.feed.FeedEvent;
import com.frontline.core.domain.feed.FeedEventKind;
import com.frontline.core.domain.influence.EventCause;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.support.EngineHarness;
import com.frontline.core.support.MutableClock;
import com.frontline.core.synchronization.FeedSubscription;
import com.frontline.core.synchronization.TerritorialFeed;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.frontline.core.support.TestWorlds.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Region 1 has districts 10, 11, 12; zone 100 (value 7) sits under 10 and zone 110 (value 9) under 11.
 *
 * Rebalancing hotspot: the scenarios are sized against the default dominance rules
 * (majority of children, or two territories of value 7 or more). Retuning
 * dominance.high_value_threshold or dominance.high_value_count moves these
 * expectations first.
 */
@Tag("balance")
class DominanceTrackerTest {

    private TerritoryStore store;
    private TerritorialFeed feed;
    private FeedSubscription sub;
    private DominanceTracker tracker;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(0L);
        store = store(smallHierarchy(), factions(FACTION_A, FACTION_B), clock);
        feed = new TerritorialFeed(16, 16, null);
        sub = feed.subscribe();
        tracker = new DominanceTracker(store, TerritorialConfig.defaults(), feed, clock);
    }

    @Test
    @DisplayName("Holding a majority of the region's children is dominance, published once")
    void majorityOfChildren() {
        store.setInfluence(10, FACTION_A, 70);
        store.setInfluence(11, FACTION_A, 65);

        List<FeedEvent> events = tracker.evaluate(List.of(11));

        assertEquals(1, events.size());
        FeedEvent e = events.get(0);
        assertEquals(FeedEventKind.DOMINANCE, e.kind());
        assertEquals(1, e.territoryId());
        assertNull(e.previousControllerId());
        assertEquals(FACTION_A, e.newControllerId());
        assertEquals(List.of(10, 11, 12), e.connectedTerritoryIds());
        assertEquals(List.of(e), sub.drain());

        assertTrue(tracker.evaluate(List.of(10, 11)).isEmpty());
        assertEquals(FACTION_A, tracker.dominantIn(1));
    }

    @Test
    @DisplayName("Holding enough high-value ground anywhere in the region is dominance (balance knobs: value 7, count 2)")
    void highValueGround() {
        store.setInfluence(10, FACTION_A, 70);
        store.setInfluence(100, FACTION_B, 80);
        store.setInfluence(110, FACTION_B, 80);

        tracker.evaluate(List.of(110));

        assertEquals(FACTION_B, tracker.dominantIn(1));
    }

    @Test
    @DisplayName("When both rules qualify different factions, more children wins")
    void childrenBeatHighValue() {
        store.setInfluence(10, FACTION_A, 70);
        store.setInfluence(11, FACTION_A, 70);
        store.setInfluence(100, FACTION_B, 80);
        store.setInfluence(110, FACTION_B, 80);

        tracker.evaluate(List.of(100));

        assertEquals(FACTION_A, tracker.dominantIn(1));
    }

    @Test
    @DisplayName("Losing dominance publishes a transition to no one")
    void losingDominance() {
        store.setInfluence(10, FACTION_A, 70);
        store.setInfluence(11, FACTION_A, 70);
        tracker.evaluate(List.of(10));

        store.setInfluence(11, FACTION_A, 10);
        List<FeedEvent> events = tracker.evaluate(List.of(11));

        assertEquals(1, events.size());
        assertEquals(FACTION_A, events.get(0).previousControllerId());
        assertNull(events.get(0).newControllerId());
        assertTrue(tracker.allDominance().isEmpty());
    }

    @Test
    @DisplayName("Rebaselining after a world load is silent")
    void rebaselineIsSilent() {
        store.setInfluence(10, FACTION_A, 70);
        store.setInfluence(11, FACTION_A, 70);

        tracker.rebaseline();

        assertEquals(FACTION_A, tracker.dominantIn(1));
        assertTrue(tracker.evaluate(List.of(10)).isEmpty());
        assertTrue(sub.drain().isEmpty());
    }

    @Test
    @DisplayName("Captures through the engine re-evaluate dominance")
    void engineTriggersDominance() {
        EngineHarness h = new EngineHarness(smallHierarchy(), factions(FACTION_A, FACTION_B), 5L);
        FeedSubscription engineFeed = h.feed.subscribe();

        h.engine.applyAction(10, FACTION_A, 70, EventCause.CAPTURE, "s");
        h.engine.applyAction(11, FACTION_A, 70, EventCause.CAPTURE, "s");

        List<FeedEvent> dominance = engineFeed.drain().stream()
                .filter(e -> e.kind() == FeedEventKind.DOMINANCE)
                .toList();
        assertEquals(1, dominance.size());
        assertEquals(FACTION_A, dominance.get(0).newControllerId());
    }
}
