package com.frontline.core.domain.ai;

import com.frontline.core.domain.factions.BehaviorProfile;
import com.frontline.core.domain.factions.FactionDefinition;
import com.frontline.core.domain.influence.InfluenceSnapshot;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.TerritoryGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Observe, score and select for one faction tick.
 *
 * Pure function of (faction, view): no clock, no randomness, no store access.
 * The caller owns the only side effect (emitting the chosen action).
 */
public final class FactionStrategist {

    /** Highest score first, then strategic value, then target controller, then territory, then action. */
    static final Comparator<StrategicDecision> SELECTION_ORDER =
            Comparator.comparingDouble(StrategicDecision::score).reversed()
                    .thenComparing(Comparator.comparingInt(StrategicDecision::strategicValue).reversed())
                    .thenComparingInt(d -> d.targetControllerId() == null ? -1 : d.targetControllerId())
                    .thenComparingInt(StrategicDecision::territoryId)
                    .thenComparingInt(d -> d.action().ordinal());

    public Optional<StrategicDecision> decide(FactionDefinition faction, WorldView view) {
        return score(faction, view).stream()
                .filter(d -> d.score() > 0.0)
                .min(SELECTION_ORDER);
    }

    /**
     * Every scored candidate for this tick, unsorted. Exposed so balancing tools
     * can print the full table instead of only the winner.
     */
    public List<StrategicDecision> score(FactionDefinition faction, WorldView view) {
        Objects.requireNonNull(faction, "faction");
        Objects.requireNonNull(view, "view");

        int factionId = faction.id();
        BehaviorProfile p = faction.profile();
        TerritoryGraph graph = view.graph();

        Set<Integer> reachable = reachableFrom(factionId, view);
        List<StrategicDecision> out = new ArrayList<>();

        for (int territoryId : reachable) {
            Territory t = graph.get(territoryId);
            if (t == null) continue;

            InfluenceSnapshot s = view.snapshot(territoryId);
            double own = s.influenceOf(factionId);
            Integer controller = s.controllerId();
            double sv = t.strategicValue() / 10.0;

            Integer rival = s.strongestRival(factionId);
            double rivalValue = (rival != null) ? s.influenceOf(rival) : 0.0;

            if (controller == null) {
                // EXPAND: free ground next to (or inside) our presence
                double presenceBonus = (own > 0.0) ? 0.1 : 0.0;
                double score = p.expansionPriority() * (0.5 + 0.5 * sv) + presenceBonus;
                if (s.contested()) score -= 0.2 * (1.0 - p.riskTolerance());
                out.add(decision(factionId, StrategicAction.EXPAND, t, null, score));
            } else if (controller != factionId) {
                // ATTACK: weakly held or contested enemy ground
                double holderValue = s.influenceOf(controller);
                double weakness = 1.0 - holderValue / 100.0;
                double contestBonus = s.contested() ? 0.3 : 0.0;
                double score = p.aggression() * (0.4 * weakness + 0.3 * sv + contestBonus);
                out.add(decision(factionId, StrategicAction.ATTACK, t, controller, score));

                // RETREAT: our foothold is collapsing under a stronger holder
                if (own > 0.0 && own < view.contestThreshold() && holderValue > own) {
                    double collapse = (holderValue - own) / 100.0;
                    double retreat = (1.0 - p.riskTolerance()) * collapse * 0.8;
                    out.add(decision(factionId, StrategicAction.RETREAT, t, controller, retreat));
                }

                // NEGOTIATE: we are a real party to a contest we do not hold
                if (s.contested() && own >= view.contestThreshold()) {
                    double score2 = p.diplomaticTendency() * 0.6;
                    out.add(decision(factionId, StrategicAction.NEGOTIATE, t, controller, score2));
                }
            } else {
                double threat = rivalValue / 100.0;

                // DEFEND: a rival is pressing on held ground
                if (rival != null && rivalValue >= view.contestThreshold()) {
                    double score = (0.5 * threat + 0.3 * sv + (s.contested() ? 0.2 : 0.0))
                            * (1.0 - 0.5 * p.riskTolerance());
                    out.add(decision(factionId, StrategicAction.DEFEND, t, rival, score));
                }

                // FORTIFY: top up held ground, weighted by its economic worth
                if (own < 100.0) {
                    double headroom = 1.0 - own / 100.0;
                    double worth = Math.min(1.0, t.resourceMultiplier() / 2.0);
                    double score = p.resourceFocus() * headroom * (0.3 + 0.3 * sv + 0.4 * worth);
                    out.add(decision(factionId, StrategicAction.FORTIFY, t, null, score));
                }

                // PATROL: low baseline so quiet ticks still refresh held ground
                double patrol = 0.05 + 0.1 * (1.0 - p.aggression()) * (1.0 - threat);
                out.add(decision(factionId, StrategicAction.PATROL, t, null, patrol));
            }
        }

        return out;
    }

    /**
     * Territories the faction can act on: where it already has presence plus
     * their neighborhoods. A faction with no presence anywhere may only expand
     * into uncontrolled ground.
     */
    private static Set<Integer> reachableFrom(int factionId, WorldView view) {
        TerritoryGraph graph = view.graph();
        Map<Integer, Double> presence = view.presenceOf(factionId);
        Set<Integer> out = new TreeSet<>();

        if (presence.isEmpty()) {
            for (Territory t : graph.all()) {
                if (view.controllerOf(t.id()) == null) out.add(t.id());
            }
            return out;
        }

        for (int id : presence.keySet()) {
            out.add(id);
            out.addAll(graph.cascadeNeighborhood(id));
            out.addAll(graph.connected(id));
        }
        return out;
    }

    private static StrategicDecision decision(int factionId, StrategicAction action, Territory t,
                                              Integer targetController, double score) {
        double bounded = Math.max(0.0, Math.min(1.0, score));
        return new StrategicDecision(factionId, action, t.id(), targetController, t.strategicValue(), bounded);
    }
}
