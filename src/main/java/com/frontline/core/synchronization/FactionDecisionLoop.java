package com.frontline.core.synchronization;

import com.frontline.core.domain.ai.FactionStrategist;
import com.frontline.core.domain.ai.StrategicDecision;
import com.frontline.core.domain.ai.WorldView;
import com.frontline.core.domain.errors.TerritorialValidationException;
import com.frontline.core.domain.factions.FactionDefinition;
import com.frontline.core.domain.influence.InfluenceAction;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.managers.TerritoryStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * One autonomous strategic loop per faction.
 *
 * Each faction gets its own single-thread scheduler, so a slow faction never delays
 * another. A tick observes a frozen {@link WorldView}, scores, selects and emits at
 * most one action into the shared {@link ActionQueue}. A tick whose observe+score
 * phase overruns the budget emits nothing; it is not retried.
 */
public class FactionDecisionLoop {

    private final TerritoryStore store;
    private final FactionStrategist strategist;
    private final ActionQueue queue;
    private final TerritorialConfig config;
    private final EngineTelemetry telemetry;
    private final LongSupplier nanoTime;

    private final ConcurrentHashMap<Integer, ScheduledExecutorService> schedulers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, AtomicLong> ticks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, TickHealthMonitor> monitors = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    public FactionDecisionLoop(TerritoryStore store, FactionStrategist strategist, ActionQueue queue,
                               TerritorialConfig config, EngineTelemetry telemetry) {
        this(store, strategist, queue, config, telemetry, System::nanoTime);
    }

    public FactionDecisionLoop(TerritoryStore store, FactionStrategist strategist, ActionQueue queue,
                               TerritorialConfig config, EngineTelemetry telemetry, LongSupplier nanoTime) {
        this.store = store;
        this.strategist = strategist;
        this.queue = queue;
        this.config = config;
        this.telemetry = (telemetry != null) ? telemetry : new EngineTelemetry();
        this.nanoTime = (nanoTime != null) ? nanoTime : System::nanoTime;
    }

    public void start() {
        if (running) return;
        running = true;

        long intervalMs = config.decisionIntervalSeconds() * 1000L;
        List<FactionDefinition> roster = new ArrayList<>(store.factions());
        for (int i = 0; i < roster.size(); i++) {
            FactionDefinition f = roster.get(i);
            String name = "fl-faction-" + f.code().toLowerCase(Locale.ROOT);

            ScheduledExecutorService s = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            });
            schedulers.put(f.id(), s);
            monitors.put(f.id(), new TickHealthMonitor(name, intervalMs, intervalMs));

            // stagger factions across the interval
            long initialDelay = (intervalMs * i) / Math.max(1, roster.size());
            s.scheduleAtFixedRate(() -> {
                if (!running) return;
                try {
                    long tick = ticks.computeIfAbsent(f.id(), k -> new AtomicLong()).incrementAndGet();
                    monitors.get(f.id()).onTickStart(tick);
                    tick(f.id());
                } catch (Throwable t) {
                    System.err.println("[DECISION] Exception in faction loop " + f.code() + ":");
                    t.printStackTrace();
                }
            }, initialDelay, intervalMs, TimeUnit.MILLISECONDS);
        }

        System.out.println("[DECISION] Faction loops started: " + roster.size() +
                " factions every " + config.decisionIntervalSeconds() + "s.");
    }

    /**
     * One observe/score/select/emit pass for a faction. Usable directly from tests.
     *
     * @return the emitted decision, empty when nothing scored or the tick was skipped
     */
    public Optional<StrategicDecision> tick(int factionId) {
        FactionDefinition faction = store.getFaction(factionId);
        if (faction == null) return Optional.empty();

        long startNs = nanoTime.getAsLong();
        WorldView view = store.worldView();
        Optional<StrategicDecision> decision = strategist.decide(faction, view);
        long elapsedMs = (nanoTime.getAsLong() - startNs) / 1_000_000L;

        if (elapsedMs > config.decisionBudgetMs()) {
            telemetry.decisionTickSkipped();
            System.err.println("[DECISION] Faction " + faction.code() + " tick skipped: took " + elapsedMs +
                    "ms (budget=" + config.decisionBudgetMs() + "ms).");
            return Optional.empty();
        }
        if (decision.isEmpty()) return Optional.empty();

        StrategicDecision d = decision.get();
        InfluenceAction action = d.toInfluenceAction(config.decisionBaseMagnitude(), faction.influenceModifier());
        try {
            queue.submit(action);
        } catch (TerritorialValidationException e) {
            System.err.println("[DECISION] Faction " + faction.code() + " emitted a rejected action: " + e.getMessage());
            return Optional.empty();
        }
        return decision;
    }

    public long getTickCount(int factionId) {
        AtomicLong t = ticks.get(factionId);
        return (t != null) ? t.get() : 0L;
    }

    public boolean isRunning() {
        return running;
    }

    public void stop() {
        running = false;
        for (ScheduledExecutorService s : schedulers.values()) {
            s.shutdown();
            try {
                if (!s.awaitTermination(2, TimeUnit.SECONDS)) {
                    s.shutdownNow();
                }
            } catch (InterruptedException e) {
                s.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        schedulers.clear();
    }
}
