package com.frontline.core.synchronization;

import com.frontline.core.domain.errors.TerritorialValidationException;
import com.frontline.core.domain.influence.ControlChangeResult;
import com.frontline.core.domain.influence.EventCause;
import com.frontline.core.domain.influence.InfluenceAction;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.managers.InfluenceEngine;
import com.frontline.core.managers.TerritoryStore;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared inbound queue for player and faction actions.
 *
 * One serial lane per territory: actions on the same territory run strictly in
 * submission order, lanes for different territories run in parallel on the
 * worker pool. Validation happens on the submitting thread, so a rejected action
 * never reaches a lane.
 */
public class ActionQueue implements AutoCloseable {

    private final InfluenceEngine engine;
    private final TerritoryStore store;
    private final EngineTelemetry telemetry;
    private final ExecutorService workers;

    private final ConcurrentHashMap<Integer, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public ActionQueue(InfluenceEngine engine, EngineTelemetry telemetry, int workerThreads) {
        this.engine = engine;
        this.store = engine.store();
        this.telemetry = (telemetry != null) ? telemetry : new EngineTelemetry();

        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), r -> {
            Thread t = new Thread(r, "fl-action-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @throws TerritorialValidationException if the action can never be applied
     */
    public CompletableFuture<ControlChangeResult> submit(InfluenceAction action) {
        validate(action);

        int territoryId = action.territoryId();
        AtomicReference<CompletableFuture<ControlChangeResult>> holder = new AtomicReference<>();

        tails.compute(territoryId, (k, tail) -> {
            CompletableFuture<Void> base = (tail != null) ? tail : CompletableFuture.completedFuture(null);
            CompletableFuture<ControlChangeResult> next = base.thenApplyAsync(v -> engine.applyAction(action), workers);
            holder.set(next);
            return next.handle((r, ex) -> null);
        });

        CompletableFuture<ControlChangeResult> result = holder.get();
        result.whenComplete((r, ex) -> {
            if (ex != null) {
                System.err.println("[ACTIONS] Action failed on territory " + territoryId + ": " + ex.getMessage());
            }
            tails.computeIfPresent(territoryId, (k, tail) -> tail.isDone() ? null : tail);
        });
        return result;
    }

    private void validate(InfluenceAction action) {
        try {
            if (action == null) throw new TerritorialValidationException("Action is required");
            store.requireTerritory(action.territoryId());
            store.requireFaction(action.factionId());
            if (action.cause() == null || action.cause() == EventCause.CASCADE) {
                throw new TerritorialValidationException("Invalid action cause: " + action.cause());
            }
            if (!Double.isFinite(action.rawDelta())) {
                throw new TerritorialValidationException("Delta must be finite: " + action.rawDelta());
            }
        } catch (TerritorialValidationException e) {
            telemetry.actionRejected();
            throw e;
        }
    }

    public int activeLanes() {
        return tails.size();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
