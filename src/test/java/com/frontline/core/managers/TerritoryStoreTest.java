package com.frontline.core.managers;

import com.frontline.core.domain.errors.TerritorialValidationException;
import com.frontline.core.domain.influence.ControlChangeResult;
import com.frontline.core.domain.influence.InfluenceRecord;
import com.frontline.core.domain.territory.TerritoryGraph;
import com.frontline.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.frontline.core.support.TestWorlds.*;
import static org.junit.jupiter.api.Assertions.*;

class TerritoryStoreTest {

    private MutableClock clock;
    private TerritoryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(5_000L);
        store = store(smallHierarchy(), factions(FACTION_A, FACTION_B, FACTION_C), clock);
    }

    @Nested
    @DisplayName("Clamping")
    class Clamping {

        @Test
        @DisplayName("Values above 100 are stored as 100")
        void clampsHigh() {
            assertEquals(100.0, store.setInfluence(10, FACTION_A, 150), 1e-9);
            assertEquals(100.0, store.getInfluence(10, FACTION_A), 1e-9);
        }

        @Test
        @DisplayName("Negative values are stored as 0")
        void clampsLow() {
            assertEquals(0.0, store.setInfluence(10, FACTION_A, -5), 1e-9);
        }

        @Test
        @DisplayName("NaN is stored as 0")
        void nanIsZero() {
            assertEquals(0.0, store.setInfluence(10, FACTION_A, Double.NaN), 1e-9);
        }

        @Test
        @DisplayName("Deltas report what was actually applied")
        void appliedDeltaIsClamped() {
            store.setInfluence(10, FACTION_A, 95);

            ControlChangeResult r = store.applyDelta(10, FACTION_A, 20, true);

            assertEquals(5.0, r.appliedDelta(), 1e-9);
            assertEquals(100.0, r.resultingValue(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Control resolution")
    class Control {

        @Test
        @DisplayName("Crossing the control threshold takes control")
        void thresholdTakesControl() {
            ControlChangeResult below = store.applyDelta(100, FACTION_A, 59.0, true);
            assertFalse(below.controlChanged());
            assertNull(store.getControllingFaction(100));

            ControlChangeResult at = store.applyDelta(100, FACTION_A, 1.0, true);
            assertTrue(at.controlChanged());
            assertEquals(FACTION_A, store.getControllingFaction(100));
        }

        @Test
        @DisplayName("Equal values above threshold go to the lower faction id")
        void tieGoesToLowerId() {
            store.setInfluence(100, FACTION_B, 70);
            store.setInfluence(100, FACTION_A, 70);

            assertEquals(FACTION_A, store.getControllingFaction(100));
        }

        @Test
        @DisplayName("Two factions at the contest threshold contest the territory without a controller")
        void contestedWithoutController() {
            store.setInfluence(100, FACTION_A, 45);
            ControlChangeResult r = store.applyDelta(100, FACTION_B, 40, true);

            assertTrue(r.becameContested());
            assertTrue(store.isContested(100));
            assertNull(store.getControllingFaction(100));
        }

        @Test
        @DisplayName("listByController returns held territories in id order")
        void listByController() {
            store.setInfluence(110, FACTION_B, 80);
            store.setInfluence(10, FACTION_B, 61);
            store.setInfluence(100, FACTION_A, 61);

            assertEquals(List.of(10, 110), store.listByController(FACTION_B));
        }
    }

    @Test
    @DisplayName("Unknown territories and factions are rejected")
    void unknownIds() {
        assertThrows(TerritorialValidationException.class, () -> store.setInfluence(999, FACTION_A, 10));
        assertThrows(TerritorialValidationException.class, () -> store.setInfluence(10, 42, 10));
    }

    @Test
    @DisplayName("Snapshot versions increase with every write")
    void versionIncreases() {
        long v0 = store.snapshot(10).version();
        store.setInfluence(10, FACTION_A, 10);
        store.setInfluence(10, FACTION_B, 10);

        assertEquals(v0 + 2, store.snapshot(10).version());
    }

    @Nested
    @DisplayName("Dirty tracking")
    class Dirty {

        @Test
        @DisplayName("Drain returns each written record once")
        void drainOnce() {
            store.setInfluence(10, FACTION_A, 10);
            store.setInfluence(10, FACTION_A, 20);
            store.setInfluence(11, FACTION_B, 5);

            List<InfluenceRecord> drained = store.drainDirty();

            assertEquals(2, drained.size());
            assertEquals(0, store.dirtyCount());
            assertTrue(drained.stream().anyMatch(r -> r.territoryId() == 10 && r.value() == 20.0));
        }

        @Test
        @DisplayName("Re-marked records come back on the next drain")
        void remark() {
            store.setInfluence(10, FACTION_A, 10);
            List<InfluenceRecord> drained = store.drainDirty();

            store.markDirty(drained);

            assertEquals(1, store.dirtyCount());
            assertEquals(drained, store.drainDirty());
        }
    }

    @Test
    @DisplayName("Loading a world skips rows for unknown territories and factions")
    void loadWorldSkipsUnknownRows() {
        store.loadWorld(TerritoryGraph.build(smallHierarchy()), factions(FACTION_A), List.of(
                new InfluenceRecord(10, FACTION_A, 70, 0L, 0L),
                new InfluenceRecord(10, FACTION_B, 30, 0L, 0L),
                new InfluenceRecord(999, FACTION_A, 30, 0L, 0L)
        ));

        assertEquals(FACTION_A, store.getControllingFaction(10));
        assertEquals(1, store.allRecords().size());
        assertEquals(0, store.dirtyCount());
    }

    @Test
    @DisplayName("A snapshot taken inside a territory write does not deadlock")
    void snapshotAllInsideWrite() {
        int size = store.withTerritoryLock(10, () -> store.snapshotAll().size());

        assertEquals(7, size);
    }
}
