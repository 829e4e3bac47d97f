package com.frontline.core.domain.territory;

import com.frontline.core.domain.factions.FactionDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graph-load integrity checks. Collects every problem instead of stopping at the
 * first one so an authoring file can be fixed in a single pass.
 */
public final class TerritoryGraphValidator {

    private TerritoryGraphValidator() {}

    public static List<String> validate(Collection<Territory> territories) {
        List<String> errorLog = new ArrayList<>();
        if (territories == null || territories.isEmpty()) {
            errorLog.add("world has no territories");
            return errorLog;
        }

        Map<Integer, Territory> byId = new HashMap<>();
        for (Territory t : territories) {
            if (t == null) {
                errorLog.add("null territory entry");
                continue;
            }
            if (byId.putIfAbsent(t.id(), t) != null) {
                errorLog.add("duplicate territory id " + t.id());
            }
        }

        for (Territory t : byId.values()) {
            detectAuthoringRanges(t, errorLog);
            detectParentMismatch(t, byId, errorLog);
            detectAsymmetricLinks(t, byId, errorLog);
        }

        detectParentCycles(byId, errorLog);
        return errorLog;
    }

    public static List<String> validateFactions(Collection<FactionDefinition> factions) {
        List<String> errorLog = new ArrayList<>();
        if (factions == null) return errorLog;

        Set<Integer> seen = new HashSet<>();
        for (FactionDefinition f : factions) {
            if (f == null) {
                errorLog.add("null faction entry");
                continue;
            }
            if (f.id() <= 0) errorLog.add("faction id must be positive: " + f.id());
            if (!seen.add(f.id())) errorLog.add("duplicate faction id " + f.id());
            if (!f.profile().isWithinBounds()) {
                errorLog.add("faction " + f.id() + ": behavior profile values must be within [0,1]");
            }
        }
        return errorLog;
    }

    private static void detectAuthoringRanges(Territory t, List<String> errorLog) {
        if (t.level() == null) {
            errorLog.add("territory " + t.id() + ": missing hierarchy level");
        }
        if (t.strategicValue() < 1 || t.strategicValue() > 10) {
            errorLog.add("territory " + t.id() + ": strategic value " + t.strategicValue() + " outside 1-10");
        }
        if (Double.isNaN(t.resourceMultiplier()) || t.resourceMultiplier() < 0.0) {
            errorLog.add("territory " + t.id() + ": negative resource multiplier");
        }
        if (Double.isNaN(t.decayRate()) || t.decayRate() < 0.0) {
            errorLog.add("territory " + t.id() + ": negative decay rate");
        }
    }

    private static void detectParentMismatch(Territory t, Map<Integer, Territory> byId, List<String> errorLog) {
        if (t.parentId() == null) return;

        if (t.parentId() == t.id()) {
            errorLog.add("territory " + t.id() + " is its own parent");
            return;
        }

        Territory parent = byId.get(t.parentId());
        if (parent == null) {
            errorLog.add("territory " + t.id() + ": parent " + t.parentId() + " does not exist");
            return;
        }

        if (parent.level() != null && t.level() != null && !parent.level().isDirectParentOf(t.level())) {
            errorLog.add("territory " + t.id() + " (" + t.level() + "): parent " + parent.id()
                    + " is " + parent.level() + ", expected exactly one level higher");
        }
    }

    private static void detectAsymmetricLinks(Territory t, Map<Integer, Territory> byId, List<String> errorLog) {
        for (Integer other : t.crossLinks()) {
            if (other == null) {
                errorLog.add("territory " + t.id() + ": null cross-link");
                continue;
            }
            if (other == t.id()) {
                errorLog.add("territory " + t.id() + ": cross-link to itself");
                continue;
            }
            Territory target = byId.get(other);
            if (target == null) {
                errorLog.add("territory " + t.id() + ": cross-link to unknown territory " + other);
                continue;
            }
            if (!target.crossLinks().contains(t.id())) {
                errorLog.add("asymmetric cross-link " + t.id() + " -> " + other);
            }
        }
    }

    private static void detectParentCycles(Map<Integer, Territory> byId, List<String> errorLog) {
        Set<Integer> reported = new HashSet<>();
        for (Territory start : byId.values()) {
            Set<Integer> chain = new HashSet<>();
            Territory cur = start;
            while (cur != null && cur.parentId() != null) {
                if (!chain.add(cur.id())) {
                    if (reported.add(start.id())) {
                        errorLog.add("parent cycle reachable from territory " + start.id());
                    }
                    break;
                }
                cur = byId.get(cur.parentId());
            }
        }
    }

    public static void printErrors(List<String> errorLog) {
        if (errorLog == null || errorLog.isEmpty()) return;

        if (errorLog.size() > 100) {
            System.err.println("[WORLD] Rejected world definition: " + errorLog.size() + " problems (too many to list)");
        } else {
            System.err.println("[WORLD] Rejected world definition:");
            for (String s : errorLog) System.err.println("  - " + s);
        }
    }
}
