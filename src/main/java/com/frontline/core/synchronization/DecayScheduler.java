package com.frontline.core.synchronization;

import com.frontline.core.domain.influence.ControlChangeResult;
import com.frontline.core.domain.influence.InfluenceRecord;
import com.frontline.core.domain.influence.InfluenceSnapshot;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.infrastructure.TerritorialConfig;
import com.frontline.core.managers.InfluenceEngine;
import com.frontline.core.managers.TerritoryStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic passive influence loss.
 *
 * Every record whose last refresh is older than the grace window loses its
 * territory's decay rate once per sweep. Decay does not refresh the record, so an
 * untouched value keeps decaying every interval until it reaches zero.
 */
public class DecayScheduler {

    private final InfluenceEngine engine;
    private final TerritoryStore store;
    private final TerritorialConfig config;
    private final EngineTelemetry telemetry;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private volatile boolean running = false;

    public DecayScheduler(InfluenceEngine engine, TerritorialConfig config, EngineTelemetry telemetry, Clock clock) {
        this.engine = engine;
        this.store = engine.store();
        this.config = config;
        this.telemetry = (telemetry != null) ? telemetry : new EngineTelemetry();
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fl-decay");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running) return;
        running = true;

        long interval = config.decayIntervalSeconds();
        scheduler.scheduleAtFixedRate(() -> {
            if (!running) return;
            try {
                SweepReport r = sweep();
                if (r.flips() > 0) {
                    System.out.println("[DECAY] Sweep decayed " + r.decayed() + " records, " + r.flips() + " passive flips.");
                }
            } catch (Throwable t) {
                System.err.println("[DECAY] Sweep failed:");
                t.printStackTrace();
            }
        }, interval, interval, TimeUnit.SECONDS);

        System.out.println("[DECAY] Scheduler started: every " + interval + "s, grace " + config.decayGraceSeconds() + "s.");
    }

    /**
     * One full pass over every territory. Also used by the admin surface for a manual sweep.
     */
    public SweepReport sweep() {
        long now = clock.millis();
        long graceMs = config.decayGraceMs();
        int decayed = 0;
        int flips = 0;

        Map<Integer, InfluenceSnapshot> all = store.snapshotAll();
        for (Map.Entry<Integer, InfluenceSnapshot> e : all.entrySet()) {
            Territory t = store.getTerritory(e.getKey());
            if (t == null) continue;
            double rate = t.decayRate();
            if (rate <= 0.0) continue;

            List<InfluenceRecord> due = new ArrayList<>();
            for (InfluenceRecord r : e.getValue().records().values()) {
                if (r.value() <= 0.0) continue;
                if (now - r.lastRefreshedMs() < graceMs) continue;
                due.add(r);
            }

            // re-checked under the territory lock: an action may refresh the record after the snapshot
            for (InfluenceRecord r : due) {
                ControlChangeResult res = engine.applyDecay(r.territoryId(), r.factionId(), rate, now - graceMs);
                if (res == null) continue;
                decayed++;
                if (res.controlChanged()) flips++;
            }
        }

        telemetry.decaySweep();
        return new SweepReport(decayed, flips);
    }

    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public record SweepReport(int decayed, int flips) {}
}
