package com.frontline.core.managers;

import com.frontline.core.domain.errors.GraphConsistencyException;
import com.frontline.core.domain.influence.ControlChangeResult;
import com.frontline.core.domain.influence.InfluenceRecord;
import com.frontline.core.domain.territory.TerritoryGraph;
import com.frontline.core.domain.territory.TerritoryGraphValidator;
import com.frontline.core.domain.territory.WorldDefinition;
import com.frontline.core.ports.ITerritoryRepository;
import com.frontline.core.synchronization.DecayScheduler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Out-of-band administration: world replacement, forced influence, manual decay.
 * None of it is on the real-time path.
 */
public class AdminService {

    private final TerritoryStore store;
    private final InfluenceEngine engine;
    private final DominanceTracker dominance;
    private final DecayScheduler decay;
    private final ITerritoryRepository repository;

    public AdminService(TerritoryStore store,
                        InfluenceEngine engine,
                        DominanceTracker dominance,
                        DecayScheduler decay,
                        ITerritoryRepository repository) {
        this.store = store;
        this.engine = engine;
        this.dominance = dominance;
        this.decay = decay;
        this.repository = repository;
    }

    /**
     * Validates and installs a new graph and roster. On any consistency problem the
     * live store keeps its previous world.
     *
     * @param influence starting influence, may be empty
     * @param persist   also replace the stored world definition; every live record is
     *                  then marked dirty, since the stored influence goes with the old world
     * @throws GraphConsistencyException listing every problem found
     */
    public void loadWorld(WorldDefinition world, Collection<InfluenceRecord> influence, boolean persist) {
        if (world == null) throw new GraphConsistencyException(List.of("World definition is required"));

        List<String> problems = new ArrayList<>(TerritoryGraphValidator.validateFactions(world.factions()));
        TerritoryGraph graph;
        try {
            graph = TerritoryGraph.build(world.territories());
        } catch (GraphConsistencyException e) {
            problems.addAll(0, e.getProblems());
            graph = null;
        }

        if (!problems.isEmpty()) {
            System.err.println("[ADMIN] World rejected, " + problems.size() + " problems:");
            TerritoryGraphValidator.printErrors(problems);
            throw new GraphConsistencyException(problems);
        }

        store.loadWorld(graph, world.factions(), influence);
        dominance.rebaseline();

        if (persist && repository != null) {
            repository.replaceWorld(world);
            // replacing the world drops stored influence, write the live records back
            store.markDirty(store.allRecords());
        }
    }

    public ControlChangeResult forceSetInfluence(int territoryId, int factionId, double value, String adminId) {
        String actor = (adminId != null && !adminId.isBlank()) ? adminId : "admin";
        ControlChangeResult r = engine.forceInfluence(territoryId, factionId, value, actor);
        System.out.println("[ADMIN] " + actor + " set influence territory=" + territoryId +
                " faction=" + factionId + " value=" + r.resultingValue());
        return r;
    }

    public DecayScheduler.SweepReport triggerDecaySweep() {
        DecayScheduler.SweepReport r = decay.sweep();
        System.out.println("[ADMIN] Manual decay sweep: decayed=" + r.decayed() + " flips=" + r.flips());
        return r;
    }
}
