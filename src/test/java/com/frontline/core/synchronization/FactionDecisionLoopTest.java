package com.frontline.core.synchronization;

import com.frontline.core.domain.ai.FactionStrategist;
import com.frontline.core.domain.ai.StrategicAction;
import com.frontline.core.domain.ai.StrategicDecision;
import com.frontline.core.domain.errors.TerritorialValidationException;
import com.frontline.core.domain.factions.BehaviorProfile;
import com.frontline.core.domain.influence.EventCause;
import com.frontline.core.domain.influence.InfluenceAction;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.managers.TerritoryStore;
import com.frontline.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static com.frontline.core.support.TestWorlds.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * One decision tick per call; the scheduler threads are never started here.
 */
@ExtendWith(MockitoExtension.class)
class FactionDecisionLoopTest {

    private static final BehaviorProfile SETTLER = new BehaviorProfile(0.0, 0.5, 1.0, 0.0, 0.0);

    @Mock
    private ActionQueue queue;

    private TerritoryStore store;
    private EngineTelemetry telemetry;

    @BeforeEach
    void setUp() {
        store = store(linkedPair(), List.of(faction(FACTION_A, SETTLER, 1.2)), new MutableClock(0L));
        telemetry = new EngineTelemetry();
    }

    private FactionDecisionLoop loop(long... nanos) {
        AtomicLong call = new AtomicLong();
        return new FactionDecisionLoop(store, new FactionStrategist(), queue, TerritorialConfig.defaults(), telemetry,
                () -> nanos.length == 0 ? 0L : nanos[(int) Math.min(call.getAndIncrement(), nanos.length - 1)]);
    }

    @Test
    @DisplayName("A tick emits the best action through the queue with the faction modifier applied")
    void emitsDecision() {
        Optional<StrategicDecision> d = loop().tick(FACTION_A);

        assertTrue(d.isPresent());
        assertEquals(StrategicAction.EXPAND, d.get().action());
        assertEquals(1, d.get().territoryId());
        verify(queue).submit(new InfluenceAction(1, FACTION_A, 10.0 * 1.0 * 1.2, EventCause.CAPTURE,
                "faction:" + FACTION_A, null));
    }

    @Test
    @DisplayName("A tick that overruns its budget is skipped and counted")
    void overBudgetSkipped() {
        Optional<StrategicDecision> d = loop(0L, 80_000_000L).tick(FACTION_A);

        assertTrue(d.isEmpty());
        assertEquals(1, telemetry.getDecisionTicksSkipped());
        verifyNoInteractions(queue);
    }

    @Test
    @DisplayName("A rejected action does not break the loop")
    void rejectedAction() {
        when(queue.submit(any())).thenThrow(new TerritorialValidationException("closed"));

        assertTrue(loop().tick(FACTION_A).isEmpty());
    }

    @Test
    @DisplayName("Unknown factions never tick")
    void unknownFaction() {
        assertTrue(loop().tick(99).isEmpty());
        verifyNoInteractions(queue);
        assertEquals(0, loop().getTickCount(FACTION_A));
    }
}
