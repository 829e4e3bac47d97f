package com.frontline.core.managers;

import com.frontline.core.domain.influence.ControlChangeResult;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.TerritoryGraph;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.infrastructure.TerritorialConfig;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.LongSupplier;

/**
 * Second-order effects of a control flip.
 *
 * Breadth-first by wave. Wave 1 is the flipped territory's cascade neighborhood
 * (parent, children, cross-links); wave N+1 expands only from territories that were
 * selected in wave N. A territory is visited at most once per pass and the
 * originator is never a target, which rules out back-reinforcement and bounds
 * the pass on cyclic cross-links.
 *
 * Probability for a neighbor at wave w:
 * <pre>
 *   p = min(maxProbability,
 *           dampening * (sv / 10) * distanceDecay^(w-1)
 *           * (0.5 + 0.5 * centrality(neighbor))
 *           * (1 + reinforcementBonus if the new controller already holds influence there))
 * </pre>
 * A selected neighbor receives {@code sv * p * deltaScale} for the new controller.
 */
public final class CascadeEngine {

    private final TerritoryStore store;
    private final TerritorialConfig config;
    private final Random random;
    private final EngineTelemetry telemetry;
    private final LongSupplier nanoTime;

    // Rate-limit truncation warnings
    private volatile long lastWarnMs = 0L;
    private static final long WARN_MIN_INTERVAL_MS = 1000L;

    public CascadeEngine(TerritoryStore store, TerritorialConfig config, Random random, EngineTelemetry telemetry) {
        this(store, config, random, telemetry, System::nanoTime);
    }

    public CascadeEngine(TerritoryStore store, TerritorialConfig config, Random random,
                         EngineTelemetry telemetry, LongSupplier nanoTime) {
        this.store = store;
        this.config = config;
        this.random = (random != null) ? random : new Random();
        this.telemetry = (telemetry != null) ? telemetry : new EngineTelemetry();
        this.nanoTime = (nanoTime != null) ? nanoTime : System::nanoTime;
    }

    /**
     * Applies one cascade delta through the engine, so it is logged and published
     * like any other write but never starts a new pass.
     */
    @FunctionalInterface
    public interface CascadeApplier {
        ControlChangeResult apply(int territoryId, int factionId, double delta, int wave);
    }

    public CascadeReport propagate(ControlChangeResult trigger, CascadeApplier applier) {
        int originId = trigger.territoryId();
        Integer newController = trigger.newControllerId();
        if (newController == null || !trigger.controlChanged() || config.cascadeMaxDepth() <= 0) {
            return CascadeReport.empty(originId);
        }

        TerritoryGraph graph = store.graph();
        Territory origin = graph.get(originId);
        if (origin == null) return CascadeReport.empty(originId);

        telemetry.cascadeRun();

        long startNs = nanoTime.getAsLong();
        long budgetNs = config.cascadeBudgetMs() * 1_000_000L;
        double signal = origin.strategicValue() / 10.0;

        Set<Integer> visited = new LinkedHashSet<>();
        visited.add(originId);

        List<CascadeStep> steps = new ArrayList<>();
        List<Integer> frontier = List.of(originId);
        int wavesCompleted = 0;
        boolean truncated = false;

        for (int wave = 1; wave <= config.cascadeMaxDepth() && !frontier.isEmpty(); wave++) {
            Set<Integer> candidates = new TreeSet<>();
            for (int from : frontier) {
                for (int n : graph.cascadeNeighborhood(from)) {
                    if (!visited.contains(n)) candidates.add(n);
                }
            }
            visited.addAll(candidates);

            List<Integer> selected = new ArrayList<>();
            for (int neighborId : candidates) {
                if (nanoTime.getAsLong() - startNs > budgetNs) {
                    truncated = true;
                    break;
                }

                double p = probability(signal, wave, graph.centrality(neighborId),
                        store.getInfluence(neighborId, newController) > 0.0);
                double roll = random.nextDouble();
                if (roll >= p) {
                    steps.add(new CascadeStep(wave, neighborId, p, false, 0.0, null));
                    continue;
                }

                double delta = origin.strategicValue() * p * config.cascadeDeltaScale();
                ControlChangeResult applied = applier.apply(neighborId, newController, delta, wave);
                telemetry.cascadeDeltaApplied();
                steps.add(new CascadeStep(wave, neighborId, p, true, delta, applied));
                selected.add(neighborId);
            }

            if (truncated) break;
            wavesCompleted = wave;
            frontier = selected;
        }

        if (truncated) {
            telemetry.cascadeTruncated();
            warnTruncated(originId, wavesCompleted, (nanoTime.getAsLong() - startNs) / 1_000_000L);
        }

        return new CascadeReport(originId, newController, wavesCompleted, truncated, steps);
    }

    double probability(double signal, int wave, double centrality, boolean reinforced) {
        double p = config.cascadeDampening()
                * signal
                * Math.pow(config.cascadeDistanceDecay(), wave - 1)
                * (0.5 + 0.5 * centrality);
        if (reinforced) p *= (1.0 + config.cascadeReinforcementBonus());
        return Math.max(0.0, Math.min(config.cascadeMaxProbability(), p));
    }

    private void warnTruncated(int originId, int wavesCompleted, long elapsedMs) {
        long now = System.currentTimeMillis();
        if (now - lastWarnMs < WARN_MIN_INTERVAL_MS) return;
        lastWarnMs = now;
        System.err.println("[CASCADE] Budget exceeded: origin=" + originId +
                " wavesCompleted=" + wavesCompleted +
                " elapsed=" + elapsedMs + "ms" +
                " (budget=" + config.cascadeBudgetMs() + "ms). Remaining waves dropped.");
    }

    public record CascadeStep(
            int wave,
            int territoryId,
            double probability,
            boolean selected,
            double delta,
            ControlChangeResult result
    ) {}

    public record CascadeReport(
            int originTerritoryId,
            Integer factionId,
            int wavesCompleted,
            boolean truncated,
            List<CascadeStep> steps
    ) {
        public CascadeReport {
            steps = List.copyOf(steps);
        }

        static CascadeReport empty(int originTerritoryId) {
            return new CascadeReport(originTerritoryId, null, 0, false, List.of());
        }

        public List<CascadeStep> applied() {
            List<CascadeStep> out = new ArrayList<>();
            for (CascadeStep s : steps) if (s.selected()) out.add(s);
            return out;
        }

        public boolean anyControlChanged() {
            for (CascadeStep s : steps) {
                if (s.result() != null && s.result().controlChanged()) return true;
            }
            return false;
        }
    }
}
