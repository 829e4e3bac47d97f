package com.frontline.core.managers;

import com.frontline.core.domain.ai.WorldView;
import com.frontline.core.domain.errors.TerritorialValidationException;
import com.frontline.core.domain.factions.FactionDefinition;
import com.frontline.core.domain.influence.ControlChangeResult;
import com.frontline.core.domain.influence.InfluenceRecord;
import com.frontline.core.domain.influence.InfluenceSnapshot;
import com.frontline.core.domain.territory.Territory;
import com.frontline.core.domain.territory.TerritoryGraph;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Single source of truth for the territory graph and every influence record.
 *
 * THREADING NOTES:
 * - Each territory owns a fair lock: writes to one territory are applied in arrival order,
 *   writes to different territories run in parallel.
 * - Each territory publishes an immutable {@link InfluenceSnapshot} through a volatile field,
 *   so single-territory reads never lock.
 * - Writers share the world read lock; {@link #snapshotAll()} takes the write lock for the
 *   short moment it copies the snapshot references, so it observes one coherent instant.
 */
public final class TerritoryStore {

    private final ControlResolver resolver;
    private final Clock clock;

    private final ReentrantReadWriteLock worldLock = new ReentrantReadWriteLock(true);

    private volatile TerritoryGraph graph = TerritoryGraph.empty();
    private volatile Map<Integer, FactionDefinition> factions = Map.of();
    private volatile Map<Integer, Cell> cells = Map.of();

    private final Set<InfluenceKey> dirty = ConcurrentHashMap.newKeySet();

    public TerritoryStore(ControlResolver resolver, Clock clock) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
    }

    // --- WORLD ---

    /**
     * Replaces graph, roster and influence in one step. Records for unknown
     * territories or factions are skipped with a warning.
     */
    public void loadWorld(TerritoryGraph newGraph, Collection<FactionDefinition> roster, Collection<InfluenceRecord> records) {
        Objects.requireNonNull(newGraph, "graph");

        Map<Integer, FactionDefinition> factionMap = new TreeMap<>();
        if (roster != null) {
            for (FactionDefinition f : roster) factionMap.put(f.id(), f);
        }

        Map<Integer, Map<Integer, InfluenceRecord>> byTerritory = new HashMap<>();
        int skipped = 0;
        if (records != null) {
            for (InfluenceRecord r : records) {
                if (!newGraph.contains(r.territoryId()) || !factionMap.containsKey(r.factionId())) {
                    skipped++;
                    continue;
                }
                double v = clamp(r.value());
                byTerritory.computeIfAbsent(r.territoryId(), k -> new TreeMap<>())
                        .put(r.factionId(), new InfluenceRecord(r.territoryId(), r.factionId(), v,
                                r.lastRefreshedMs(), r.lastUpdatedMs()));
            }
        }

        Map<Integer, Cell> newCells = new HashMap<>();
        for (int id : newGraph.ids()) {
            Map<Integer, InfluenceRecord> recs = byTerritory.getOrDefault(id, Map.of());
            ControlResolver.Resolution res = resolver.resolve(recs);
            newCells.put(id, new Cell(new InfluenceSnapshot(id, recs, res.controllerId(), res.contested(), 0L)));
        }

        worldLock.writeLock().lock();
        try {
            this.graph = newGraph;
            this.factions = Collections.unmodifiableMap(factionMap);
            this.cells = Collections.unmodifiableMap(newCells);
            dirty.clear();
        } finally {
            worldLock.writeLock().unlock();
        }

        if (skipped > 0) {
            System.err.println("[STORE] Skipped " + skipped + " influence rows for unknown territories/factions.");
        }
        System.out.println("[STORE] World loaded: territories=" + newGraph.size() + " factions=" + factionMap.size());
    }

    public TerritoryGraph graph() {
        return graph;
    }

    public Territory getTerritory(int territoryId) {
        return graph.get(territoryId);
    }

    public Territory requireTerritory(int territoryId) {
        Territory t = graph.get(territoryId);
        if (t == null) throw new TerritorialValidationException("Unknown territory id: " + territoryId);
        return t;
    }

    public FactionDefinition getFaction(int factionId) {
        return factions.get(factionId);
    }

    public FactionDefinition requireFaction(int factionId) {
        FactionDefinition f = factions.get(factionId);
        if (f == null) throw new TerritorialValidationException("Unknown faction id: " + factionId);
        return f;
    }

    public Collection<FactionDefinition> factions() {
        return factions.values();
    }

    public List<Integer> getConnected(int territoryId) {
        requireTerritory(territoryId);
        return graph.connected(territoryId);
    }

    // --- READS ---

    public InfluenceSnapshot snapshot(int territoryId) {
        return cell(territoryId).snapshot;
    }

    public double getInfluence(int territoryId, int factionId) {
        return snapshot(territoryId).influenceOf(factionId);
    }

    public Integer getControllingFaction(int territoryId) {
        return snapshot(territoryId).controllerId();
    }

    public boolean isContested(int territoryId) {
        return snapshot(territoryId).contested();
    }

    public List<Integer> listByController(int factionId) {
        List<Integer> out = new ArrayList<>();
        for (Map.Entry<Integer, InfluenceSnapshot> e : snapshotAll().entrySet()) {
            if (Objects.equals(e.getValue().controllerId(), factionId)) out.add(e.getKey());
        }
        return out;
    }

    /**
     * Coherent copy of every territory's snapshot, keyed by id in ascending order.
     * Called from inside a territory write it degrades to a plain copy.
     */
    public Map<Integer, InfluenceSnapshot> snapshotAll() {
        boolean insideWrite = worldLock.getReadHoldCount() > 0;
        if (!insideWrite) worldLock.writeLock().lock();
        try {
            Map<Integer, InfluenceSnapshot> out = new TreeMap<>();
            for (Map.Entry<Integer, Cell> e : cells.entrySet()) {
                out.put(e.getKey(), e.getValue().snapshot);
            }
            return out;
        } finally {
            if (!insideWrite) worldLock.writeLock().unlock();
        }
    }

    public WorldView worldView() {
        return new WorldView(graph, snapshotAll(), resolver.controlThreshold(), resolver.contestThreshold());
    }

    // --- WRITES ---

    /**
     * Runs {@code body} while holding the territory's lock. Store writes made by the
     * body re-enter the same lock, so a read-modify-write plus its bookkeeping is atomic
     * with respect to other writers of that territory.
     */
    public <T> T withTerritoryLock(int territoryId, Supplier<T> body) {
        worldLock.readLock().lock();
        try {
            Cell cell = cell(territoryId);
            cell.lock.lock();
            try {
                return body.get();
            } finally {
                cell.lock.unlock();
            }
        } finally {
            worldLock.readLock().unlock();
        }
    }

    public boolean isHeldByCurrentThread(int territoryId) {
        return cell(territoryId).lock.isHeldByCurrentThread();
    }

    /**
     * Sets an absolute influence value. Out of range input is clamped, never rejected.
     *
     * @return the value actually stored
     */
    public double setInfluence(int territoryId, int factionId, double value) {
        return write(territoryId, factionId, value, true).resultingValue();
    }

    /**
     * Adds {@code delta} to the faction's value, clamped to [0,100].
     *
     * @param refresh whether the write counts as an action for the decay grace window
     */
    public ControlChangeResult applyDelta(int territoryId, int factionId, double delta, boolean refresh) {
        return withTerritoryLock(territoryId, () -> {
            double current = snapshot(territoryId).influenceOf(factionId);
            double d = Double.isFinite(delta) ? delta : 0.0;
            return write(territoryId, factionId, current + d, refresh);
        });
    }

    /**
     * Absolute write with full control resolution. Used by admin force-set and replay.
     */
    public ControlChangeResult write(int territoryId, int factionId, double value, boolean refresh) {
        requireFaction(factionId);
        return withTerritoryLock(territoryId, () -> {
            Cell cell = cell(territoryId);
            InfluenceSnapshot before = cell.snapshot;

            double previous = before.influenceOf(factionId);
            double applied = clamp(value);
            long now = clock.millis();

            Map<Integer, InfluenceRecord> recs = new TreeMap<>(before.records());
            InfluenceRecord old = recs.get(factionId);
            InfluenceRecord updated = (old != null)
                    ? old.withValue(applied, now, refresh)
                    : new InfluenceRecord(territoryId, factionId, applied, refresh ? now : 0L, now);
            recs.put(factionId, updated);

            ControlResolver.Resolution res = resolver.resolve(recs);
            cell.snapshot = new InfluenceSnapshot(territoryId, recs, res.controllerId(), res.contested(), before.version() + 1);
            dirty.add(new InfluenceKey(territoryId, factionId));

            return new ControlChangeResult(
                    territoryId,
                    factionId,
                    before.controllerId(),
                    res.controllerId(),
                    before.contested(),
                    res.contested(),
                    applied - previous,
                    applied
            );
        });
    }

    // --- PERSISTENCE SUPPORT ---

    /**
     * Removes and returns every record written since the last drain.
     * The caller re-marks them with {@link #markDirty} if the save fails.
     */
    public List<InfluenceRecord> drainDirty() {
        List<InfluenceRecord> out = new ArrayList<>();
        for (InfluenceKey key : new ArrayList<>(dirty)) {
            dirty.remove(key);
            Cell cell = cells.get(key.territoryId());
            if (cell == null) continue;
            InfluenceRecord r = cell.snapshot.records().get(key.factionId());
            if (r != null) out.add(r);
        }
        return out;
    }

    public void markDirty(Collection<InfluenceRecord> records) {
        if (records == null) return;
        for (InfluenceRecord r : records) {
            if (cells.containsKey(r.territoryId())) dirty.add(new InfluenceKey(r.territoryId(), r.factionId()));
        }
    }

    public int dirtyCount() {
        return dirty.size();
    }

    public List<InfluenceRecord> allRecords() {
        List<InfluenceRecord> out = new ArrayList<>();
        for (InfluenceSnapshot s : snapshotAll().values()) {
            out.addAll(s.records().values());
        }
        return out;
    }

    private Cell cell(int territoryId) {
        Cell c = cells.get(territoryId);
        if (c == null) throw new TerritorialValidationException("Unknown territory id: " + territoryId);
        return c;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static final class Cell {
        final ReentrantLock lock = new ReentrantLock(true);
        volatile InfluenceSnapshot snapshot;

        Cell(InfluenceSnapshot snapshot) {
            this.snapshot = snapshot;
        }
    }

    private record InfluenceKey(int territoryId, int factionId) {}
}
