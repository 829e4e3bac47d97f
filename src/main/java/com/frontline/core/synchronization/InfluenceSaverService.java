package com.frontline.core.synchronization;

import com.frontline.core.domain.influence.InfluenceRecord;
import com.frontline.core.domain.telemetry.EngineTelemetry;
import com.frontline.core.managers.TerritoryStore;
import com.frontline.core.ports.ITerritoryRepository;

import java.util.List;

/**
 * Write-behind snapshot of dirty influence records.
 *
 * Runs on the persistence scheduler, never inside an action. A failed save puts
 * the records back in the dirty set for the next cycle.
 */
public class InfluenceSaverService {

    private final TerritoryStore store;
    private final ITerritoryRepository repository;
    private final EngineTelemetry telemetry;

    public InfluenceSaverService(TerritoryStore store, ITerritoryRepository repository, EngineTelemetry telemetry) {
        this.store = store;
        this.repository = repository;
        this.telemetry = (telemetry != null) ? telemetry : new EngineTelemetry();
    }

    /**
     * @return number of records written, 0 on failure or when nothing was dirty
     */
    public int autoSaveTask() {
        List<InfluenceRecord> dirty = store.drainDirty();
        if (dirty.isEmpty()) return 0;

        try {
            repository.saveInfluence(dirty);
            System.out.println("[SAVER] Saved influence records=" + dirty.size());
            return dirty.size();
        } catch (Exception ex) {
            store.markDirty(dirty);
            telemetry.saveFailure();
            System.err.println("[SAVER] Influence save failed for " + dirty.size() + " records (dirty kept, will retry).");
            ex.printStackTrace();
            return 0;
        }
    }
}
